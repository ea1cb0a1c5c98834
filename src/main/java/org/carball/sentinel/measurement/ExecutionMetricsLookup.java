package org.carball.sentinel.measurement;

import org.carball.sentinel.model.measurement.ExecutionMetrics;

import java.util.Optional;

@FunctionalInterface
public interface ExecutionMetricsLookup {

    Optional<ExecutionMetrics> findMetrics(String executionId);
}
