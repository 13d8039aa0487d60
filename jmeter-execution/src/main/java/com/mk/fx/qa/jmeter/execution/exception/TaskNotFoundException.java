package com.mk.fx.qa.jmeter.execution.exception;

import java.util.UUID;

public class TaskNotFoundException extends RunnerException {

  public TaskNotFoundException(UUID taskId) {
    super("Task not found: " + taskId);
  }
}
