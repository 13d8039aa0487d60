package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import java.util.UUID;

/**
 * Response object for run submission.
 * Contains the run ID, status, and an optional message.
 */
public record TaskSubmissionResponse(
    UUID taskId, String definitionName, TaskStatus status, String message) {}
