package com.mk.fx.qa.jmeter.execution;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

/** Shared test plans, configuration and fake engine scripts. */
public final class Fixtures {

  public static final String PLAN_NAME = "smoke.jmx";

  private Fixtures() {}

  public static byte[] plan() {
    return plan("Smoke");
  }

  /** A minimal JMeter plan; different test names give different bytes. */
  public static byte[] plan(String testName) {
    String xml =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<jmeterTestPlan version=\"1.2\" properties=\"5.0\" jmeter=\"5.5\">\n"
            + "  <hashTree>\n"
            + "    <TestPlan guiclass=\"TestPlanGui\" testclass=\"TestPlan\" testname=\""
            + testName
            + "\" enabled=\"true\">\n"
            + "      <stringProp name=\"TestPlan.comments\">generated for tests</stringProp>\n"
            + "      <boolProp name=\"TestPlan.functional_mode\">false</boolProp>\n"
            + "    </TestPlan>\n"
            + "    <hashTree/>\n"
            + "  </hashTree>\n"
            + "</jmeterTestPlan>\n";
    return xml.getBytes(StandardCharsets.UTF_8);
  }

  public static RunnerCfg cfg(Path workspace) {
    RunnerCfg cfg = new RunnerCfg();
    cfg.setWorkspace(workspace.toString());
    return cfg;
  }

  /**
   * Configuration whose engine is {@code /bin/sh <runScript> <definition> <resultLog> <engineLog>}
   * and whose report tool is {@code /bin/sh <reportScript> <resultLog> <reportDir>}.
   */
  public static RunnerCfg shellEngineCfg(Path workspace, Path runScript, Path reportScript) {
    RunnerCfg cfg = cfg(workspace);
    cfg.getEngine().setExecutable("/bin/sh");
    cfg.getEngine()
        .setRunArguments(
            List.of(runScript.toString(), "{definition}", "{resultLog}", "{engineLog}"));
    if (reportScript != null) {
      cfg.getEngine()
          .setReportArguments(List.of(reportScript.toString(), "{resultLog}", "{reportDir}"));
    }
    return cfg;
  }

  public static Path script(Path dir, String name, String body) throws IOException {
    Path script = dir.resolve(name);
    Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }

  /** Writes a result log and exits 0. */
  public static Path successScript(Path dir) throws IOException {
    return script(
        dir, "engine-ok.sh", "echo \"running $1\"\necho '<testResults/>' > \"$2\"\nexit 0");
  }
}
