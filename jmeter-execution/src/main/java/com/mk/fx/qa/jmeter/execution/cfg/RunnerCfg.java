package com.mk.fx.qa.jmeter.execution.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "jmeter.runner")
public class RunnerCfg {

  /** Root directory for definitions, run outputs and reports. */
  @NotBlank private String workspace = "data";

  @Valid @NotNull private Execution execution = new Execution();

  @Valid @NotNull private Engine engine = new Engine();

  @Valid @NotNull private Validation validation = new Validation();

  @Data
  public static class Execution {

    @Min(1)
    @Max(64)
    private int concurrency = 2;

    /** Pending runs the dispatch queue accepts before rejecting submissions. */
    @Positive private int maxPending = 100;

    @NotNull private Duration timeout = Duration.ofHours(1);

    /** Time between a graceful terminate and a forced kill of the process tree. */
    @NotNull private Duration killGrace = Duration.ofSeconds(5);

    /** Back-off once every queued run was found waiting on a busy definition. */
    @NotNull private Duration lockRetryDelay = Duration.ofMillis(200);

    @NotNull private Duration shutdownTimeout = Duration.ofSeconds(30);

    @Positive private int historySize = 50;
  }

  @Data
  public static class Engine {

    @NotBlank private String executable = "/opt/apache-jmeter-5.5/bin/jmeter";

    /**
     * Arguments of a test run. Whole-argument placeholders {@code {definition}}, {@code
     * {resultLog}} and {@code {engineLog}} are replaced with server-side paths.
     */
    @NotEmpty
    private List<String> runArguments =
        new ArrayList<>(
            List.of(
                "-n",
                "-t",
                "{definition}",
                "-l",
                "{resultLog}",
                "-j",
                "{engineLog}",
                "-Jjmeter.save.saveservice.output_format=xml",
                "-Jjmeter.save.saveservice.response_data.on_error=true"));

    /** Arguments of report generation; placeholders {@code {resultLog}} and {@code {reportDir}}. */
    @NotEmpty
    private List<String> reportArguments =
        new ArrayList<>(List.of("-g", "{resultLog}", "-o", "{reportDir}"));

    @NotNull private Duration reportTimeout = Duration.ofMinutes(5);
  }

  @Data
  public static class Validation {

    @Positive private long maxSizeBytes = 100L * 1024 * 1024;

    @NotEmpty private List<String> allowedExtensions = new ArrayList<>(List.of(".jmx"));

    @NotEmpty
    private List<String> allowedContentTypes =
        new ArrayList<>(List.of("application/xml", "text/xml", "text/plain"));

    private List<String> denyPatterns =
        new ArrayList<>(
            List.of(
                "<script",
                "javascript:",
                "vbscript:",
                "onload=",
                "onerror=",
                "eval(",
                "exec(",
                "__import__",
                "subprocess",
                "os.system"));

    @NotBlank private String rootElement = "jmeterTestPlan";
  }
}
