package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

/**
 * This class represents the response structure for run metrics.
 * It contains counters of completed, failed and cancelled runs,
 * average duration of completed runs, success rate, and total finished runs.
 */
public record TaskMetricsResponse(
        long totalCompleted,
        long totalFailed,
        long totalCancelled,
        double averageProcessingTimeMillis,
        double successRate,
        long totalProcessed
) {
}
