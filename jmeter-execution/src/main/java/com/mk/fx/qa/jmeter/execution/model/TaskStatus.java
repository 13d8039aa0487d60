package com.mk.fx.qa.jmeter.execution.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a run.
 *
 * <p>PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED}, plus PENDING → CANCELLED. Terminal states
 * have no outgoing edges.
 */
public enum TaskStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  private static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  /** Returns true if the state machine has an edge from this state to {@code target}. */
  public boolean canTransitionTo(TaskStatus target) {
    return switch (this) {
      case PENDING -> target == RUNNING || target == CANCELLED;
      case RUNNING -> target.isTerminal();
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }

  public static TaskStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported task status: " + value));
  }
}
