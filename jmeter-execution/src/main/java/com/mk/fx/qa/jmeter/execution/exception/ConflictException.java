package com.mk.fx.qa.jmeter.execution.exception;

/**
 * The requested change does not apply to the current state, typically because a concurrent
 * caller got there first. Callers should re-read and decide again.
 */
public class ConflictException extends RunnerException {

  public ConflictException(String message) {
    super(message);
  }
}
