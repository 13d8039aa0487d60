package com.mk.fx.qa.jmeter.execution.dispatch;

import com.mk.fx.qa.jmeter.execution.exception.SaturatedException;
import java.time.Duration;
import java.util.UUID;

/**
 * Hands PENDING task ids to the worker pool in FIFO order.
 *
 * <p>The dispatcher only carries ids. Whether an id is still worth running is decided against the
 * task repository when it is pulled, so implementations may deliver stale ids.
 */
public interface Dispatcher {

  /**
   * Appends a new id.
   *
   * @throws SaturatedException if the queue is at capacity
   */
  void submit(UUID taskId);

  /** Takes the oldest id, waiting up to {@code timeout}; returns null if none arrived. */
  UUID pull(Duration timeout) throws InterruptedException;

  /** Puts an id that was pulled but could not start back at the end. Never rejected. */
  void requeue(UUID taskId);

  /** Drops an id that no longer needs to run. Returns true if it was queued. */
  boolean remove(UUID taskId);

  int size();
}
