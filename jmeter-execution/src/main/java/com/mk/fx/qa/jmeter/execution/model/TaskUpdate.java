package com.mk.fx.qa.jmeter.execution.model;

/**
 * The fields a state transition may record alongside the new status. Anything not listed here can
 * only be changed by the repository itself.
 */
public record TaskUpdate(Integer exitCode, String errorMessage, String outputLogRef) {

  private static final TaskUpdate NONE = new TaskUpdate(null, null, null);

  public static TaskUpdate none() {
    return NONE;
  }

  public static TaskUpdate error(String message) {
    return new TaskUpdate(null, message, null);
  }

  public static TaskUpdate completed(int exitCode, String outputLogRef) {
    return new TaskUpdate(exitCode, null, outputLogRef);
  }

  public static TaskUpdate failed(Integer exitCode, String message, String outputLogRef) {
    return new TaskUpdate(exitCode, message, outputLogRef);
  }
}
