package com.mk.fx.qa.jmeter.execution.exception;

public class ServiceShutdownException extends RunnerException {

  public ServiceShutdownException(String message) {
    super(message);
  }
}
