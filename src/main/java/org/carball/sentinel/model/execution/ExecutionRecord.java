package org.carball.sentinel.model.execution;

import java.time.Instant;

/**
 * A completed query's identity and timing, as captured by the telemetry collector.
 */
public record ExecutionRecord(
        String executionId,
        String sqlText,
        String submitter,
        String queueName,
        Instant startTime,
        Instant endTime,
        long durationMs,
        ExecutionStatus status
) {

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }
}
