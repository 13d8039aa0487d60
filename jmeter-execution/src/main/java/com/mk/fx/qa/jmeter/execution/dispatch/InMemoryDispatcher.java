package com.mk.fx.qa.jmeter.execution.dispatch;

import com.mk.fx.qa.jmeter.execution.exception.SaturatedException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local dispatcher backed by a deque. The capacity bounds new submissions only; a
 * requeue always succeeds, so an id that was pulled can never be lost.
 */
@Slf4j
public class InMemoryDispatcher implements Dispatcher {

  private final int capacity;
  private final BlockingDeque<UUID> queue = new LinkedBlockingDeque<>();

  public InMemoryDispatcher(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void submit(UUID taskId) {
    if (queue.size() >= capacity) {
      log.warn("Dispatch queue saturated ({} pending), rejecting {}", queue.size(), taskId);
      throw new SaturatedException("Dispatch queue is full (" + capacity + " pending runs)");
    }
    queue.offerLast(taskId);
  }

  @Override
  public UUID pull(Duration timeout) throws InterruptedException {
    return queue.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void requeue(UUID taskId) {
    queue.offerLast(taskId);
  }

  @Override
  public boolean remove(UUID taskId) {
    return queue.remove(taskId);
  }

  @Override
  public int size() {
    return queue.size();
  }

  public int getCapacity() {
    return capacity;
  }
}
