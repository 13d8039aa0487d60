package com.mk.fx.qa.jmeter.execution.exception;

/** The dispatch queue is at capacity. */
public class SaturatedException extends RunnerException {

  public SaturatedException(String message) {
    super(message);
  }
}
