package com.mk.fx.qa.jmeter.execution.model;

import java.time.Instant;

/**
 * An accepted test plan. The {@code name} is the validated client name and identifies the
 * definition; {@code storageKey} is generated by the server and is the only thing used to build
 * on-disk paths.
 */
public record DefinitionFile(
    String name,
    String storageKey,
    long sizeBytes,
    String sha256,
    String contentType,
    Instant uploadedAt) {}
