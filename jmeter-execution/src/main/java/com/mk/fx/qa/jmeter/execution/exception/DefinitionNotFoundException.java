package com.mk.fx.qa.jmeter.execution.exception;

public class DefinitionNotFoundException extends RunnerException {

  public DefinitionNotFoundException(String name) {
    super("Definition not found: " + name);
  }
}
