package com.mk.fx.qa.jmeter.execution.exception;

import com.mk.fx.qa.jmeter.execution.model.ArtifactKind;
import java.util.UUID;

/** The run exists but has not produced the requested file. */
public class ArtifactNotFoundException extends RunnerException {

  public ArtifactNotFoundException(UUID taskId, ArtifactKind kind) {
    super("Artifact " + kind.fileName() + " not found for task " + taskId);
  }
}
