package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents the status of a run. Contains the run ID, the definition it executes, its status,
 * timestamps, the engine exit code and error message if any, and references to its artifacts.
 */
public record TaskStatusResponse(
    UUID taskId,
    String definitionName,
    TaskStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Long durationMillis,
    Integer exitCode,
    String errorMessage,
    String outputLogRef,
    String reportRef) {}
