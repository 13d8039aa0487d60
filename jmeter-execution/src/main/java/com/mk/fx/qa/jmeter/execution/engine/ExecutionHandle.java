package com.mk.fx.qa.jmeter.execution.engine;

import java.util.UUID;

/**
 * Connects a cancellation request to the process of a run. The handle exists before the process
 * does, so a cancel that arrives between the RUNNING transition and the spawn is not lost.
 */
public class ExecutionHandle {

  private final UUID taskId;
  private Process process;
  private boolean cancelled;

  public ExecutionHandle(UUID taskId) {
    this.taskId = taskId;
  }

  public UUID getTaskId() {
    return taskId;
  }

  /**
   * Binds the spawned process.
   *
   * @return false if the run was cancelled before the process existed; the caller must then
   *     terminate it
   */
  public synchronized boolean attach(Process process) {
    this.process = process;
    return !cancelled;
  }

  /**
   * Marks the run cancelled.
   *
   * @return the process to terminate, or null if none was attached yet
   */
  public synchronized Process cancel() {
    cancelled = true;
    return process;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }
}
