package com.mk.fx.qa.jmeter.execution.engine;

/**
 * How an engine subprocess ended. Subprocess failures are values, not exceptions, so the caller
 * always takes the terminal transition itself.
 */
public record ExecutionOutcome(Kind kind, Integer exitCode, String message) {

  public enum Kind {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED,
    LAUNCH_FAILED
  }

  public static ExecutionOutcome succeeded() {
    return new ExecutionOutcome(Kind.SUCCEEDED, 0, null);
  }

  public static ExecutionOutcome failed(Integer exitCode, String message) {
    return new ExecutionOutcome(Kind.FAILED, exitCode, message);
  }

  public static ExecutionOutcome timedOut(String message) {
    return new ExecutionOutcome(Kind.TIMED_OUT, null, message);
  }

  public static ExecutionOutcome cancelled() {
    return new ExecutionOutcome(Kind.CANCELLED, null, "cancelled by request");
  }

  public static ExecutionOutcome launchFailed(String message) {
    return new ExecutionOutcome(Kind.LAUNCH_FAILED, null, message);
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCEEDED;
  }
}
