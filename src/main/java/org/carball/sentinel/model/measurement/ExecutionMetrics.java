package org.carball.sentinel.model.measurement;

import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;

import java.util.EnumMap;
import java.util.Map;

/**
 * The metrics captured for one execution when measuring a fix. Values are null when unknown.
 */
public record ExecutionMetrics(
        Double durationMs,
        Double memoryMb,
        Double dataScannedMb,
        Double cpuTimeMs
) {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public static ExecutionMetrics from(ExecutionRecord record, ExecutionProfile profile) {
        Double duration = (double) record.durationMs();
        if (profile == null) {
            return new ExecutionMetrics(duration, null, null, null);
        }
        return new ExecutionMetrics(
                duration,
                toMb(profile.getMemoryAllocatedBytes()),
                toMb(profile.getBytesScanned()),
                profile.getCpuTimeMs() == null ? null : profile.getCpuTimeMs().doubleValue());
    }

    public Double valueOf(MeasuredMetric metric) {
        switch (metric) {
            case DURATION:
                return durationMs;
            case MEMORY:
                return memoryMb;
            case DATA_SCANNED:
                return dataScannedMb;
            case CPU_TIME:
                return cpuTimeMs;
            default:
                throw new IllegalArgumentException("Unsupported metric: " + metric);
        }
    }

    public Map<MeasuredMetric, Double> asMap() {
        Map<MeasuredMetric, Double> values = new EnumMap<>(MeasuredMetric.class);
        for (MeasuredMetric metric : MeasuredMetric.values()) {
            Double value = valueOf(metric);
            if (value != null) {
                values.put(metric, value);
            }
        }
        return values;
    }

    private static Double toMb(Long bytes) {
        return bytes == null ? null : bytes / BYTES_PER_MB;
    }
}
