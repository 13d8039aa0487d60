package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

/** Response object for health check endpoint. Contains the overall status and its inputs. */
public record HealthResponse(
    String status, boolean engineAvailable, boolean workspaceWritable, boolean acceptingTasks) {}
