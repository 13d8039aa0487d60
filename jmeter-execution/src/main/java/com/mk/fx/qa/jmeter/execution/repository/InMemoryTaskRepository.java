package com.mk.fx.qa.jmeter.execution.repository;

import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.model.TaskFilter;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.model.TaskUpdate;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TaskRepository} backed by a {@link ConcurrentHashMap}. Each mutation runs inside {@link
 * ConcurrentHashMap#compute}, which serialises writers per task id.
 */
@Slf4j
public class InMemoryTaskRepository implements TaskRepository {

  private final Map<UUID, Entry> tasks = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryTaskRepository(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Task create(String definitionName) {
    Objects.requireNonNull(definitionName, "definitionName");
    var task =
        Task.builder()
            .taskId(UUID.randomUUID())
            .definitionName(definitionName)
            .status(TaskStatus.PENDING)
            .createdAt(Instant.now(clock))
            .build();
    tasks.put(task.taskId(), new Entry(sequence.incrementAndGet(), task));
    log.debug("Task {} created for {}", task.taskId(), definitionName);
    return task;
  }

  @Override
  public Optional<Task> get(UUID taskId) {
    var entry = tasks.get(taskId);
    return entry == null ? Optional.empty() : Optional.of(entry.task());
  }

  @Override
  public List<Task> list(TaskFilter filter) {
    return tasks.values().stream()
        .filter(entry -> filter.matches(entry.task()))
        .sorted(Comparator.comparingLong(Entry::sequence))
        .skip(filter.offset())
        .limit(filter.limit())
        .map(Entry::task)
        .toList();
  }

  @Override
  public Task transition(UUID taskId, Set<TaskStatus> from, TaskStatus to, TaskUpdate update) {
    if (from.isEmpty()) {
      throw new IllegalArgumentException("At least one source state is required");
    }
    for (TaskStatus source : from) {
      if (!source.canTransitionTo(to)) {
        throw new IllegalArgumentException("Illegal transition " + source + " -> " + to);
      }
    }
    var result =
        tasks.compute(
            taskId,
            (id, entry) -> {
              if (entry == null) {
                throw new TaskNotFoundException(taskId);
              }
              var current = entry.task();
              if (!from.contains(current.status())) {
                throw new ConflictException(
                    "Task " + taskId + " is " + current.status() + ", expected one of " + from);
              }
              return new Entry(entry.sequence(), apply(current, to, update));
            });
    log.debug("Task {} -> {}", taskId, to);
    return result.task();
  }

  @Override
  public Task attachReport(UUID taskId, String reportRef) {
    Objects.requireNonNull(reportRef, "reportRef");
    return tasks
        .compute(
            taskId,
            (id, entry) -> {
              if (entry == null) {
                throw new TaskNotFoundException(taskId);
              }
              var current = entry.task();
              if (current.status() != TaskStatus.COMPLETED) {
                throw new ConflictException(
                    "Task " + taskId + " is " + current.status() + ", reports need COMPLETED");
              }
              if (current.reportRef() != null) {
                throw new ConflictException("Task " + taskId + " already has a report");
              }
              return new Entry(entry.sequence(), current.toBuilder().reportRef(reportRef).build());
            })
        .task();
  }

  private Task apply(Task current, TaskStatus to, TaskUpdate update) {
    var now = Instant.now(clock);
    var builder = current.toBuilder().status(to);
    if (current.startedAt() == null) {
      builder.startedAt(now);
    }
    if (to.isTerminal()) {
      builder.finishedAt(now);
    }
    if (update.exitCode() != null) {
      builder.exitCode(update.exitCode());
    }
    if (update.errorMessage() != null) {
      builder.errorMessage(update.errorMessage());
    }
    if (update.outputLogRef() != null) {
      builder.outputLogRef(update.outputLogRef());
    }
    return builder.build();
  }

  private record Entry(long sequence, Task task) {}
}
