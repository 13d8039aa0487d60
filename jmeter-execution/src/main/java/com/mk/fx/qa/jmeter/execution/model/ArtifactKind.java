package com.mk.fx.qa.jmeter.execution.model;

import java.util.Arrays;

/** Downloadable per-run files. */
public enum ArtifactKind {
  RESULT("result.jtl"),
  STDOUT("stdout.log"),
  STDERR("stderr.log"),
  ENGINE_LOG("jmeter.log");

  private final String fileName;

  ArtifactKind(String fileName) {
    this.fileName = fileName;
  }

  public String fileName() {
    return fileName;
  }

  public static ArtifactKind fromValue(String value) {
    String normalised = value == null ? "" : value.replace('-', '_');
    return Arrays.stream(values())
        .filter(kind -> kind.name().equalsIgnoreCase(normalised))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported artifact kind: " + value));
  }
}
