package com.mk.fx.qa.jmeter.execution.exception;

import com.mk.fx.qa.jmeter.execution.validation.ValidationErrorKind;

/** An uploaded definition was rejected. Nothing was stored. */
public class DefinitionValidationException extends RunnerException {

  private final ValidationErrorKind kind;

  public DefinitionValidationException(ValidationErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ValidationErrorKind getKind() {
    return kind;
  }
}
