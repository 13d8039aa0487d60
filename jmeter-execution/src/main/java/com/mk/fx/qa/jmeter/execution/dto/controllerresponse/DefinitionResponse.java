package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import java.time.Instant;

/** Metadata of a stored definition. The server-side storage key is not exposed. */
public record DefinitionResponse(
    String name, long sizeBytes, String sha256, String contentType, Instant uploadedAt) {}
