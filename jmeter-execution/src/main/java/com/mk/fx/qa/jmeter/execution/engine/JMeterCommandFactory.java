package com.mk.fx.qa.jmeter.execution.engine;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds engine argument vectors from the configured templates.
 *
 * <p>A placeholder is only recognised when it is a whole argument, and it is only ever replaced
 * by a server-derived absolute path. Nothing supplied by a client reaches the command line, and
 * the vector is passed to {@link ProcessBuilder} directly, never to a shell.
 */
@Component
public class JMeterCommandFactory {

  static final String DEFINITION = "{definition}";
  static final String RESULT_LOG = "{resultLog}";
  static final String ENGINE_LOG = "{engineLog}";
  static final String REPORT_DIR = "{reportDir}";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{[A-Za-z]+}");

  private final String executable;
  private final List<String> runTemplate;
  private final List<String> reportTemplate;

  public JMeterCommandFactory(RunnerCfg properties) {
    var engine = properties.getEngine();
    this.executable = engine.getExecutable();
    this.runTemplate =
        checkTemplate("run", engine.getRunArguments(), Set.of(DEFINITION, RESULT_LOG, ENGINE_LOG));
    this.reportTemplate =
        checkTemplate("report", engine.getReportArguments(), Set.of(RESULT_LOG, REPORT_DIR));
  }

  public String getExecutable() {
    return executable;
  }

  public List<String> runCommand(Path definition, Path resultLog, Path engineLog) {
    return build(
        runTemplate,
        Map.of(
            DEFINITION, absolute(definition),
            RESULT_LOG, absolute(resultLog),
            ENGINE_LOG, absolute(engineLog)));
  }

  public List<String> reportCommand(Path resultLog, Path reportDir) {
    return build(
        reportTemplate, Map.of(RESULT_LOG, absolute(resultLog), REPORT_DIR, absolute(reportDir)));
  }

  private List<String> build(List<String> template, Map<String, String> values) {
    List<String> command = new ArrayList<>(template.size() + 1);
    command.add(executable);
    for (String argument : template) {
      command.add(values.getOrDefault(argument, argument));
    }
    return List.copyOf(command);
  }

  private static List<String> checkTemplate(
      String name, List<String> template, Set<String> supported) {
    for (String argument : template) {
      if (PLACEHOLDER.matcher(argument).matches() && !supported.contains(argument)) {
        throw new IllegalStateException(
            "Unknown placeholder "
                + argument
                + " in "
                + name
                + " arguments; supported: "
                + supported);
      }
    }
    return List.copyOf(template);
  }

  private static String absolute(Path path) {
    return path.toAbsolutePath().normalize().toString();
  }
}
