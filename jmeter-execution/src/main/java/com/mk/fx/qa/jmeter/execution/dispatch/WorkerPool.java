package com.mk.fx.qa.jmeter.execution.dispatch;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.engine.ExecutionEngine;
import com.mk.fx.qa.jmeter.execution.exception.BusyException;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.lock.RunLockRegistry;
import com.mk.fx.qa.jmeter.execution.lock.RunLockRegistry.LockHandle;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.model.TaskUpdate;
import com.mk.fx.qa.jmeter.execution.repository.TaskRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Moves queued runs onto a fixed set of worker threads.
 *
 * <p>A single dispatch thread takes a free slot, pulls the next id and tries the run lock of its
 * definition. A busy definition sends the id to the back of the queue and the slot is given back,
 * so runs of other definitions are not held up. Once every queued id has been found busy in a row
 * the dispatch thread backs off for {@code lockRetryDelay}.
 */
@Slf4j
@Component
public class WorkerPool {

  private static final Duration PULL_TIMEOUT = Duration.ofMillis(250);

  private final RunnerCfg properties;
  private final Dispatcher dispatcher;
  private final TaskRepository repository;
  private final RunLockRegistry runLocks;
  private final ExecutionEngine engine;
  private final ThreadPoolExecutor workers;
  private final Semaphore slots;
  private final AtomicBoolean accepting = new AtomicBoolean(false);
  private volatile Thread dispatchThread;

  public WorkerPool(
      RunnerCfg properties,
      Dispatcher dispatcher,
      TaskRepository repository,
      RunLockRegistry runLocks,
      ExecutionEngine engine) {
    this.properties = properties;
    this.dispatcher = dispatcher;
    this.repository = repository;
    this.runLocks = runLocks;
    this.engine = engine;
    int concurrency = properties.getExecution().getConcurrency();
    this.workers = createExecutor(concurrency);
    this.slots = new Semaphore(concurrency);
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("jmeter-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Worker pool is not accepting runs");
        });
    return pool;
  }

  @PostConstruct
  public synchronized void start() {
    if (dispatchThread != null) {
      return;
    }
    accepting.set(true);
    Thread thread = new Thread(this::dispatchLoop, "jmeter-run-dispatcher");
    thread.setDaemon(true);
    dispatchThread = thread;
    thread.start();
    log.info(
        "WorkerPool started with concurrency={} maxPending={} timeout={}",
        properties.getExecution().getConcurrency(),
        properties.getExecution().getMaxPending(),
        properties.getExecution().getTimeout());
  }

  private void dispatchLoop() {
    int busyStreak = 0;
    while (accepting.get()) {
      try {
        slots.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      boolean handedOff = false;
      try {
        UUID taskId = dispatcher.pull(PULL_TIMEOUT);
        if (taskId == null) {
          continue;
        }
        var task = repository.get(taskId).orElse(null);
        if (task == null || task.status() != TaskStatus.PENDING) {
          log.debug("Skipping {} which is no longer pending", taskId);
          continue;
        }

        LockHandle lock;
        try {
          lock = runLocks.acquire(task.definitionName());
        } catch (BusyException e) {
          dispatcher.requeue(taskId);
          busyStreak++;
          if (busyStreak >= dispatcher.size()) {
            busyStreak = 0;
            TimeUnit.MILLISECONDS.sleep(properties.getExecution().getLockRetryDelay().toMillis());
          }
          continue;
        }
        busyStreak = 0;
        handedOff = handOff(task, lock);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        log.error("Dispatch iteration failed: {}", e.getMessage(), e);
      } finally {
        if (!handedOff) {
          slots.release();
        }
      }
    }
    log.info("Dispatch loop stopped");
  }

  private boolean handOff(Task task, LockHandle lock) {
    try {
      workers.execute(
          () -> {
            try {
              engine.execute(task, lock);
            } catch (RuntimeException e) {
              log.error("Task {} crashed on worker: {}", task.taskId(), e.getMessage(), e);
            } finally {
              lock.release();
              slots.release();
            }
          });
      return true;
    } catch (RejectedExecutionException e) {
      log.warn("Task {} could not be handed to a worker: {}", task.taskId(), e.getMessage());
      lock.release();
      dispatcher.requeue(task.taskId());
      return false;
    }
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  public int activeCount() {
    return engine.activeCount();
  }

  public int pendingCount() {
    return dispatcher.size();
  }

  /**
   * Stops dispatching, lets running tasks finish within the shutdown timeout and then cancels what
   * is still running. Runs that never started are recorded as CANCELLED.
   */
  @PreDestroy
  public void shutdown() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    log.info("WorkerPool shutting down");
    Thread thread = dispatchThread;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(PULL_TIMEOUT.toMillis() * 4);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    workers.shutdown();
    try {
      Duration timeout = properties.getExecution().getShutdownTimeout();
      if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Runs still active after {}s, cancelling them", timeout.toSeconds());
        engine.cancelAll();
        workers.shutdownNow();
        workers.awaitTermination(
            properties.getExecution().getKillGrace().toMillis() * 2, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      engine.cancelAll();
      workers.shutdownNow();
    }
    cancelQueued();
  }

  private void cancelQueued() {
    int cancelled = 0;
    UUID taskId;
    try {
      while ((taskId = dispatcher.pull(Duration.ZERO)) != null) {
        try {
          repository.transition(
              taskId,
              Set.of(TaskStatus.PENDING),
              TaskStatus.CANCELLED,
              TaskUpdate.error("cancelled: service shutting down"));
          cancelled++;
        } catch (ConflictException e) {
          log.debug("Queued task {} was already finalised: {}", taskId, e.getMessage());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (cancelled > 0) {
      log.info("Cancelled {} queued run(s) on shutdown", cancelled);
    }
  }
}
