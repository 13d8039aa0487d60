package com.mk.fx.qa.jmeter.execution.exception;

/** The external report tool did not produce a report. */
public class ReportGenerationException extends RunnerException {

  public ReportGenerationException(String message) {
    super(message);
  }
}
