package com.mk.fx.qa.jmeter.execution.exception;

/** The run lock of a definition is held by another run. */
public class BusyException extends RunnerException {

  private final String definitionName;

  public BusyException(String definitionName) {
    super("Definition " + definitionName + " is already running");
    this.definitionName = definitionName;
  }

  public String getDefinitionName() {
    return definitionName;
  }
}
