package com.mk.fx.qa.jmeter.execution.report;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.engine.ExecutionHandle;
import com.mk.fx.qa.jmeter.execution.engine.ExecutionOutcome;
import com.mk.fx.qa.jmeter.execution.engine.JMeterCommandFactory;
import com.mk.fx.qa.jmeter.execution.engine.ProcessRunner;
import com.mk.fx.qa.jmeter.execution.exception.ReportGenerationException;
import com.mk.fx.qa.jmeter.execution.exception.StorageException;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.storage.ArtifactStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns the raw result log of a completed run into an HTML dashboard. */
@Slf4j
@Component
public class ReportGenerator {

  static final String REPORT_STDOUT = "report-stdout.log";
  static final String REPORT_STDERR = "report-stderr.log";

  private final ArtifactStore artifactStore;
  private final JMeterCommandFactory commandFactory;
  private final ProcessRunner processRunner;
  private final Duration timeout;

  public ReportGenerator(
      RunnerCfg properties,
      ArtifactStore artifactStore,
      JMeterCommandFactory commandFactory,
      ProcessRunner processRunner) {
    this.artifactStore = artifactStore;
    this.commandFactory = commandFactory;
    this.processRunner = processRunner;
    this.timeout = properties.getEngine().getReportTimeout();
  }

  /**
   * Runs the report tool for the task and returns the reference of the report directory. A
   * previous report directory of the task is replaced.
   *
   * @throws StorageException if the task has no result log
   * @throws ReportGenerationException if the tool fails or produces nothing
   */
  public String generate(Task task) {
    if (!artifactStore.exists(task.outputLogRef())) {
      throw new StorageException("Result log of task " + task.taskId() + " is missing");
    }
    Path resultLog = artifactStore.resolve(task.outputLogRef());
    Path reportDir = artifactStore.prepareReportDirectory(task.taskId());
    Path runDir = artifactStore.runPaths(task.taskId()).directory();

    var command = commandFactory.reportCommand(resultLog, reportDir);
    log.info("Generating report for task {}: {}", task.taskId(), String.join(" ", command));
    ExecutionOutcome outcome =
        processRunner.run(
            command,
            runDir.resolve(REPORT_STDOUT),
            runDir.resolve(REPORT_STDERR),
            timeout,
            new ExecutionHandle(task.taskId()));

    if (!outcome.isSuccess()) {
      throw new ReportGenerationException(
          "Report generation failed for task " + task.taskId() + ": " + outcome.message());
    }
    if (!Files.isDirectory(reportDir)) {
      throw new ReportGenerationException(
          "Report tool produced no output for task " + task.taskId());
    }
    log.info("Report for task {} written to {}", task.taskId(), reportDir);
    return artifactStore.toRef(reportDir);
  }
}
