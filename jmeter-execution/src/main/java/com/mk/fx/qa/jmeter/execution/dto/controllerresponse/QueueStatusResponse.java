package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

/**
 * Represents the status of the dispatch queue, including the number of pending runs,
 * the number of runs executing, and whether new runs are accepted.
 */
public record QueueStatusResponse(int queueSize, int activeTasks, boolean acceptingTasks) {
}
