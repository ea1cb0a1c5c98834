package org.carball.sentinel.model.measurement;

import java.time.Instant;

public record MetricSnapshot(
        String executionId,
        ExecutionMetrics metrics,
        Instant capturedAt
) {}
