package com.mk.fx.qa.jmeter.execution.engine;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionNotFoundException;
import com.mk.fx.qa.jmeter.execution.lock.RunLockRegistry.LockHandle;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.model.TaskUpdate;
import com.mk.fx.qa.jmeter.execution.repository.TaskRepository;
import com.mk.fx.qa.jmeter.execution.storage.ArtifactStore;
import com.mk.fx.qa.jmeter.execution.storage.RunPaths;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Drives a dispatched task through RUNNING to a terminal state.
 *
 * <p>The caller hands over a task together with the run lock of its definition; the engine owns
 * the lock from then on and releases it on every exit path, after the terminal transition has been
 * recorded. All status changes go through {@link TaskRepository#transition}; a lost race (for
 * example a completion racing a cancellation) shows up as a {@link ConflictException} and the
 * state already recorded wins.
 */
@Slf4j
@Component
public class ExecutionEngine {

  static final String MDC_TASK_ID = "taskId";

  private final TaskRepository repository;
  private final ArtifactStore artifactStore;
  private final JMeterCommandFactory commandFactory;
  private final ProcessRunner processRunner;
  private final Duration timeout;
  private final Map<UUID, ExecutionHandle> activeRuns = new ConcurrentHashMap<>();

  public ExecutionEngine(
      RunnerCfg properties,
      TaskRepository repository,
      ArtifactStore artifactStore,
      JMeterCommandFactory commandFactory,
      ProcessRunner processRunner) {
    this.repository = repository;
    this.artifactStore = artifactStore;
    this.commandFactory = commandFactory;
    this.processRunner = processRunner;
    this.timeout = properties.getExecution().getTimeout();
  }

  /**
   * Runs the task on the calling thread and returns its final snapshot. The lock is released
   * before this method returns, whatever happens.
   */
  public Task execute(Task task, LockHandle lock) {
    UUID taskId = task.taskId();
    MDC.put(MDC_TASK_ID, taskId.toString());
    var handle = new ExecutionHandle(taskId);
    activeRuns.put(taskId, handle);
    try {
      Task running;
      try {
        running =
            repository.transition(
                taskId, Set.of(TaskStatus.PENDING), TaskStatus.RUNNING, TaskUpdate.none());
      } catch (ConflictException e) {
        log.info("Task {} is no longer pending, skipping: {}", taskId, e.getMessage());
        return repository.get(taskId).orElse(task);
      }
      log.info("Task {} started for definition {}", taskId, running.definitionName());

      RunPaths paths = null;
      ExecutionOutcome outcome;
      try {
        paths = artifactStore.prepareRun(taskId);
        outcome = launch(running, paths, handle);
      } catch (RuntimeException e) {
        log.error("Task {} could not be executed: {}", taskId, e.getMessage(), e);
        outcome = ExecutionOutcome.launchFailed(e.getMessage());
      }
      try {
        return record(running, paths, outcome);
      } catch (RuntimeException e) {
        log.error("Task {} outcome could not be recorded: {}", taskId, e.getMessage(), e);
        return failAfterError(taskId, "internal error: " + e.getMessage());
      }
    } finally {
      activeRuns.remove(taskId);
      lock.release();
      MDC.remove(MDC_TASK_ID);
    }
  }

  /**
   * Cancels a RUNNING task: records CANCELLED, then terminates its process tree.
   *
   * @throws ConflictException if the task is not RUNNING
   */
  public void cancel(UUID taskId) {
    repository.transition(
        taskId,
        Set.of(TaskStatus.RUNNING),
        TaskStatus.CANCELLED,
        TaskUpdate.error("cancelled by request"));
    var handle = activeRuns.get(taskId);
    if (handle != null) {
      Process process = handle.cancel();
      if (process != null) {
        processRunner.terminateTree(process);
      }
    }
    log.info("Task {} cancelled while running", taskId);
  }

  /** Cancels every run in progress. Used on shutdown. */
  public void cancelAll() {
    for (UUID taskId : activeRuns.keySet()) {
      try {
        cancel(taskId);
      } catch (ConflictException e) {
        log.debug("Task {} finished before shutdown cancellation: {}", taskId, e.getMessage());
      }
    }
  }

  public int activeCount() {
    return activeRuns.size();
  }

  private ExecutionOutcome launch(Task running, RunPaths paths, ExecutionHandle handle) {
    var definition =
        artifactStore
            .findDefinition(running.definitionName())
            .orElseThrow(() -> new DefinitionNotFoundException(running.definitionName()));
    var command =
        commandFactory.runCommand(
            artifactStore.definitionPath(definition), paths.resultLog(), paths.engineLog());
    log.info("Executing command: {}", String.join(" ", command));
    return processRunner.run(command, paths.stdout(), paths.stderr(), timeout, handle);
  }

  private Task record(Task running, RunPaths paths, ExecutionOutcome outcome) {
    UUID taskId = running.taskId();
    String outputLogRef =
        paths != null && Files.exists(paths.resultLog())
            ? artifactStore.toRef(paths.resultLog())
            : null;

    TaskStatus target;
    TaskUpdate update;
    switch (outcome.kind()) {
      case SUCCEEDED -> {
        if (outputLogRef != null) {
          target = TaskStatus.COMPLETED;
          update = TaskUpdate.completed(outcome.exitCode(), outputLogRef);
        } else {
          target = TaskStatus.FAILED;
          update = TaskUpdate.failed(outcome.exitCode(), "engine produced no result log", null);
        }
      }
      case CANCELLED -> {
        target = TaskStatus.CANCELLED;
        update = TaskUpdate.failed(null, outcome.message(), outputLogRef);
      }
      default -> {
        target = TaskStatus.FAILED;
        update = TaskUpdate.failed(outcome.exitCode(), outcome.message(), outputLogRef);
      }
    }

    try {
      Task finished =
          repository.transition(taskId, Set.of(TaskStatus.RUNNING), target, update);
      log.info(
          "Task {} finished as {} in {} ms{}",
          taskId,
          finished.status(),
          finished.durationMillis(),
          outcome.message() == null ? "" : ": " + outcome.message());
      return finished;
    } catch (ConflictException e) {
      log.info("Task {} was already finalised, outcome {} dropped", taskId, outcome.kind());
      return repository.get(taskId).orElse(running);
    }
  }

  private Task failAfterError(UUID taskId, String message) {
    try {
      return repository.transition(
          taskId, Set.of(TaskStatus.RUNNING), TaskStatus.FAILED, TaskUpdate.error(message));
    } catch (ConflictException e) {
      return repository.get(taskId).orElseThrow(() -> e);
    }
  }
}
