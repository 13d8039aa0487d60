package com.mk.fx.qa.jmeter.execution.model;

/**
 * Read-side filter for task listings. Null criteria match everything.
 *
 * @param status only tasks in this state
 * @param definitionName only tasks of this definition
 * @param offset number of matches to skip, in creation order
 * @param limit maximum number of matches to return
 */
public record TaskFilter(TaskStatus status, String definitionName, int offset, int limit) {

  public static final int DEFAULT_LIMIT = 50;

  public TaskFilter {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }

  public static TaskFilter all() {
    return new TaskFilter(null, null, 0, Integer.MAX_VALUE);
  }

  public static TaskFilter byStatus(TaskStatus status) {
    return new TaskFilter(status, null, 0, Integer.MAX_VALUE);
  }

  public boolean matches(Task task) {
    return (status == null || task.status() == status)
        && (definitionName == null || definitionName.equals(task.definitionName()));
  }
}
