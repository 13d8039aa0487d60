package com.mk.fx.qa.jmeter.execution.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.dispatch.Dispatcher;
import com.mk.fx.qa.jmeter.execution.dispatch.WorkerPool;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.jmeter.execution.engine.ExecutionEngine;
import com.mk.fx.qa.jmeter.execution.engine.JMeterCommandFactory;
import com.mk.fx.qa.jmeter.execution.exception.ArtifactNotFoundException;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionNotFoundException;
import com.mk.fx.qa.jmeter.execution.exception.SaturatedException;
import com.mk.fx.qa.jmeter.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.jmeter.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.jmeter.execution.model.ArtifactKind;
import com.mk.fx.qa.jmeter.execution.model.DefinitionFile;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.model.TaskFilter;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.model.TaskUpdate;
import com.mk.fx.qa.jmeter.execution.report.ReportGenerator;
import com.mk.fx.qa.jmeter.execution.repository.TaskRepository;
import com.mk.fx.qa.jmeter.execution.storage.ArtifactStore;
import com.mk.fx.qa.jmeter.execution.validation.DefinitionValidator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything a client can do with definitions and runs.
 *
 * <p>Responsibilities:
 * - Validates and stores uploaded definitions.
 * - Creates runs and hands them to the {@link Dispatcher}; execution itself happens on the
 *   {@link WorkerPool}.
 * - Cancels pending and running runs, and generates reports for completed ones.
 * - Exposes read-only status, history, queue and metric views computed from the
 *   {@link TaskRepository}.
 *
 * <p>Thread-safety: all state lives in the repository, the dispatcher and the artifact store, which
 * are safe for concurrent use. Report generation is serialised per run.
 */
@Slf4j
@Service
public class LoadRunService {

  private final RunnerCfg properties;
  private final DefinitionValidator validator;
  private final ArtifactStore artifactStore;
  private final TaskRepository repository;
  private final Dispatcher dispatcher;
  private final WorkerPool workerPool;
  private final ExecutionEngine engine;
  private final ReportGenerator reportGenerator;
  private final JMeterCommandFactory commandFactory;
  private final Map<UUID, ReentrantLock> reportLocks = new ConcurrentHashMap<>();

  public LoadRunService(
      RunnerCfg properties,
      DefinitionValidator validator,
      ArtifactStore artifactStore,
      TaskRepository repository,
      Dispatcher dispatcher,
      WorkerPool workerPool,
      ExecutionEngine engine,
      ReportGenerator reportGenerator,
      JMeterCommandFactory commandFactory) {
    this.properties = properties;
    this.validator = validator;
    this.artifactStore = artifactStore;
    this.repository = repository;
    this.dispatcher = dispatcher;
    this.workerPool = workerPool;
    this.engine = engine;
    this.reportGenerator = reportGenerator;
    this.commandFactory = commandFactory;
  }

  // -----------------------------------------------------
  // Definitions
  // -----------------------------------------------------

  /**
   * Validates and stores a definition. Nothing is written when validation fails.
   *
   * @throws com.mk.fx.qa.jmeter.execution.exception.DefinitionValidationException if rejected
   * @throws ConflictException if the name is taken by different content
   */
  public DefinitionFile submitDefinition(byte[] content, String fileName) {
    var accepted = validator.validate(content, fileName).orElseThrow();
    return artifactStore.storeDefinition(accepted, content);
  }

  public List<DefinitionFile> listDefinitions() {
    return artifactStore.listDefinitions();
  }

  // -----------------------------------------------------
  // Runs
  // -----------------------------------------------------

  /**
   * Creates a PENDING run of a stored definition and queues it.
   *
   * @throws ServiceShutdownException if the worker pool no longer accepts runs
   * @throws DefinitionNotFoundException if no definition has that name
   * @throws SaturatedException if the queue is full; the created run is recorded as CANCELLED
   */
  public Task startRun(String definitionName) {
    if (!workerPool.isAccepting()) {
      throw new ServiceShutdownException("Service not accepting new runs");
    }
    artifactStore
        .findDefinition(definitionName)
        .orElseThrow(() -> new DefinitionNotFoundException(definitionName));

    Task task = repository.create(definitionName);
    try {
      dispatcher.submit(task.taskId());
    } catch (SaturatedException e) {
      repository.transition(
          task.taskId(),
          Set.of(TaskStatus.PENDING),
          TaskStatus.CANCELLED,
          TaskUpdate.error("rejected: dispatch queue saturated"));
      throw e;
    }
    log.info("Task {} submitted for definition {}", task.taskId(), definitionName);
    return task;
  }

  /** Stores the definition, then starts a run of it. */
  public Task uploadAndRun(byte[] content, String fileName) {
    DefinitionFile definition = submitDefinition(content, fileName);
    return startRun(definition.name());
  }

  public Task getTask(UUID taskId) {
    return repository.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public List<Task> listTasks(TaskFilter filter) {
    return repository.list(filter);
  }

  /**
   * Attempts to cancel the specified run.
   *
   * <p>Behaviour:
   * - A PENDING run is marked CANCELLED and dropped from the queue; it never starts.
   * - A RUNNING run is marked CANCELLED and its process tree is terminated before this returns.
   * - A finished run is left alone and reported as not cancellable.
   *
   * @param taskId id of the run to cancel
   * @return result describing the cancellation outcome and current status
   */
  public CancellationResult cancelRun(UUID taskId) {
    while (true) {
      var task = repository.get(taskId).orElse(null);
      if (task == null) {
        return CancellationResult.notFound();
      }
      try {
        switch (task.status()) {
          case PENDING -> {
            var cancelled =
                repository.transition(
                    taskId,
                    Set.of(TaskStatus.PENDING),
                    TaskStatus.CANCELLED,
                    TaskUpdate.error("cancelled by request"));
            dispatcher.remove(taskId);
            log.info("Task {} cancelled while pending", taskId);
            return CancellationResult.cancelled(cancelled.status());
          }
          case RUNNING -> {
            engine.cancel(taskId);
            return CancellationResult.cancelled(TaskStatus.CANCELLED);
          }
          default -> {
            return CancellationResult.notCancellable(task.status());
          }
        }
      } catch (ConflictException e) {
        // status moved on underneath us; decide again on the fresh state
        log.debug("Cancellation of {} raced a transition: {}", taskId, e.getMessage());
      }
    }
  }

  // -----------------------------------------------------
  // Reports and artifacts
  // -----------------------------------------------------

  /**
   * Returns the report of a COMPLETED run, generating it on first request. Concurrent callers for
   * the same run invoke the report tool at most once.
   *
   * @throws ConflictException if the run is not COMPLETED
   */
  public String requestReport(UUID taskId) {
    Task task = requireCompleted(getTask(taskId));
    if (task.reportRef() != null) {
      return task.reportRef();
    }

    while (true) {
      var lock = reportLocks.computeIfAbsent(taskId, id -> new ReentrantLock());
      lock.lock();
      try {
        if (reportLocks.get(taskId) != lock) {
          // released and dropped by the previous holder; serialize on the current one
          continue;
        }
        Task current = requireCompleted(getTask(taskId));
        if (current.reportRef() != null) {
          return current.reportRef();
        }
        String reportRef = reportGenerator.generate(current);
        repository.attachReport(taskId, reportRef);
        return reportRef;
      } finally {
        if (!lock.hasQueuedThreads()) {
          reportLocks.remove(taskId, lock);
        }
        lock.unlock();
      }
    }
  }

  @VisibleForTesting
  int reportLockCount() {
    return reportLocks.size();
  }

  private static Task requireCompleted(Task task) {
    if (task.status() != TaskStatus.COMPLETED) {
      throw new ConflictException(
          "Task " + task.taskId() + " is " + task.status() + "; reports need a completed run");
    }
    return task;
  }

  /**
   * Returns the file of a run's artifact.
   *
   * @throws TaskNotFoundException if the run does not exist
   * @throws ArtifactNotFoundException if the run has not produced that file
   */
  public Path artifact(UUID taskId, ArtifactKind kind) {
    getTask(taskId);
    Path path = artifactStore.artifactPath(taskId, kind);
    if (!Files.isRegularFile(path)) {
      throw new ArtifactNotFoundException(taskId, kind);
    }
    return path;
  }

  // -----------------------------------------------------
  // Observability
  // -----------------------------------------------------

  /** Returns finished runs, most recently finished first, up to the configured history size. */
  public List<Task> getTaskHistory() {
    return repository.list(TaskFilter.all()).stream()
        .filter(task -> task.status().isTerminal())
        .sorted(Comparator.comparing(Task::finishedAt).reversed())
        .limit(properties.getExecution().getHistorySize())
        .toList();
  }

  /** Returns the number of queued runs, executing runs and the acceptance flag. */
  public QueueStatusResponse getQueueStatus() {
    return new QueueStatusResponse(
        dispatcher.size(), workerPool.activeCount(), workerPool.isAccepting());
  }

  /** Returns aggregate metrics across all runs known to this instance. */
  public TaskMetricsResponse getMetrics() {
    long completed = 0;
    long failed = 0;
    long cancelled = 0;
    long completedDuration = 0;
    for (Task task : repository.list(TaskFilter.all())) {
      switch (task.status()) {
        case COMPLETED -> {
          completed++;
          completedDuration += task.durationMillis();
        }
        case FAILED -> failed++;
        case CANCELLED -> cancelled++;
        default -> {}
      }
    }
    var processedForSuccessRate = completed + failed;
    var avgProcessing = completed == 0 ? 0.0 : (double) completedDuration / completed;
    var successRate =
        processedForSuccessRate == 0 ? 0.0 : (double) completed / processedForSuccessRate;
    return new TaskMetricsResponse(
        completed, failed, cancelled, avgProcessing, successRate, processedForSuccessRate);
  }

  /** Simple health indicator: engine executable present, workspace writable, pool accepting. */
  public HealthResponse getHealth() {
    boolean engineAvailable = Files.isExecutable(Path.of(commandFactory.getExecutable()));
    boolean workspaceWritable = Files.isWritable(artifactStore.getRoot());
    boolean accepting = workerPool.isAccepting();
    boolean healthy = engineAvailable && workspaceWritable && accepting;
    return new HealthResponse(
        healthy ? "UP" : "DOWN", engineAvailable, workspaceWritable, accepting);
  }

  /** Describes the outcome of a cancellation attempt for a run. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final TaskStatus taskStatus;

    private CancellationResult(CancellationState state, TaskStatus taskStatus) {
      this.state = state;
      this.taskStatus = taskStatus;
    }

    /** Creates a result representing a completed cancellation. */
    public static CancellationResult cancelled(TaskStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    /** Creates a result indicating the task id was not found. */
    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    /** Creates a result indicating the run cannot be cancelled in its current state. */
    public static CancellationResult notCancellable(TaskStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
