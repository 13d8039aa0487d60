package com.mk.fx.qa.jmeter.execution.exception;

/** Reading or writing an artifact failed. */
public class StorageException extends RunnerException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
