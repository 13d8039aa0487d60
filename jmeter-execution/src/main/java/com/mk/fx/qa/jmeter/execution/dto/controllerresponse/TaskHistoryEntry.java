package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents a single entry in the run history. Contains details about the finished run,
 * including its status, timing, and any error messages.
 */
public record TaskHistoryEntry(
    UUID taskId,
    String definitionName,
    TaskStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMillis,
    Integer exitCode,
    String errorMessage) {}
