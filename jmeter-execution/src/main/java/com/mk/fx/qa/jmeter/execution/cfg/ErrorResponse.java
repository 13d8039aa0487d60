package com.mk.fx.qa.jmeter.execution.cfg;

/**
 * Represents an error response with an error message and additional details.
 *
 * @param error the error message
 * @param details additional details about the error
 * @param kind machine-readable rejection reason, only present for validation errors
 */
public record ErrorResponse(String error, String details, String kind) {

  public ErrorResponse(String error, String details) {
    this(error, details, null);
  }
}
