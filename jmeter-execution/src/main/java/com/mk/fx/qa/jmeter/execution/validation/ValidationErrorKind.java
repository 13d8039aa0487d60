package com.mk.fx.qa.jmeter.execution.validation;

/** Reasons an uploaded definition can be rejected, in the order they are checked. */
public enum ValidationErrorKind {
  MISSING_NAME,
  UNSAFE_NAME,
  BAD_EXTENSION,
  EMPTY_FILE,
  OVERSIZED,
  SIGNATURE_MISMATCH,
  UNSAFE_CONTENT,
  INVALID_STRUCTURE
}
