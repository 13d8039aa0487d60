package com.mk.fx.qa.jmeter.execution.repository;

import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.jmeter.execution.model.Task;
import com.mk.fx.qa.jmeter.execution.model.TaskFilter;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.model.TaskUpdate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Record of every submitted run and the single source of truth for its state.
 *
 * <p>{@link #transition} is the only way to change a task's status. Implementations must apply it
 * as a compare-and-swap: when several callers race from the same source state exactly one
 * succeeds and the others get a {@link ConflictException}.
 */
public interface TaskRepository {

  /** Creates a PENDING task for the definition. */
  Task create(String definitionName);

  Optional<Task> get(UUID taskId);

  /** Returns matching tasks in creation order. */
  List<Task> list(TaskFilter filter);

  /**
   * Moves a task to {@code to} if its current status is one of {@code from}. Timestamps are
   * stamped by the repository: {@code startedAt} when leaving PENDING, {@code finishedAt} when
   * entering a terminal state.
   *
   * @throws ConflictException if the current status is not in {@code from}
   * @throws TaskNotFoundException if the task does not exist
   * @throws IllegalArgumentException if an edge from {@code from} to {@code to} is not part of the
   *     state machine
   */
  Task transition(UUID taskId, Set<TaskStatus> from, TaskStatus to, TaskUpdate update);

  /**
   * Records the report reference of a COMPLETED task without touching its status.
   *
   * @throws ConflictException if the task is not COMPLETED or already has a report
   */
  Task attachReport(UUID taskId, String reportRef);
}
