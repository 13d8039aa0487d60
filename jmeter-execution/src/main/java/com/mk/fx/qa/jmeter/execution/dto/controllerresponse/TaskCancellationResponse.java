package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import java.util.UUID;

/**
 * Response object for run cancellation requests. Contains the run ID, its status after the
 * request, and an optional message.
 */
public record TaskCancellationResponse(UUID taskId, TaskStatus status, String message) {}
