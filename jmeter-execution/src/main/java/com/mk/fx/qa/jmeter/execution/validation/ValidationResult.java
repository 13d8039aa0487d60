package com.mk.fx.qa.jmeter.execution.validation;

import com.mk.fx.qa.jmeter.execution.exception.DefinitionValidationException;

/**
 * Outcome of {@link DefinitionValidator#validate}. Accepted results carry the facts the artifact
 * store records; rejected results carry exactly one {@link ValidationErrorKind}.
 */
public record ValidationResult(
    boolean accepted,
    String sanitizedName,
    long sizeBytes,
    String sha256,
    String contentType,
    ValidationErrorKind errorKind,
    String message) {

  public static ValidationResult accepted(
      String sanitizedName, long sizeBytes, String sha256, String contentType) {
    return new ValidationResult(true, sanitizedName, sizeBytes, sha256, contentType, null, null);
  }

  public static ValidationResult rejected(ValidationErrorKind kind, String message) {
    return new ValidationResult(false, null, 0L, null, null, kind, message);
  }

  /** Returns this result if accepted, otherwise throws the matching validation exception. */
  public ValidationResult orElseThrow() {
    if (!accepted) {
      throw new DefinitionValidationException(errorKind, message);
    }
    return this;
  }
}
