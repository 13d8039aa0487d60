package com.mk.fx.qa.jmeter.execution.exception;

/** Base type for every error the runner reports to its callers. */
public class RunnerException extends RuntimeException {

  public RunnerException(String message) {
    super(message);
  }

  public RunnerException(String message, Throwable cause) {
    super(message, cause);
  }
}
