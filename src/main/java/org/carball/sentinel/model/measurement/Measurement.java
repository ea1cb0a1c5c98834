package org.carball.sentinel.model.measurement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Before/after evidence for one recommendation. Instances are immutable; phase two produces a new
 * instance via {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Measurement {
    String recommendationId;
    MetricSnapshot before;
    MetricSnapshot after;
    Map<MeasuredMetric, Double> improvements;
    ValidationResult validation;
    Instant createdAt;
    Instant measuredAt;

    public boolean isCompleted() {
        return after != null && validation != null;
    }

    public Double improvementOf(MeasuredMetric metric) {
        return improvements == null ? null : improvements.get(metric);
    }

    /**
     * Milliseconds saved per execution, or null when either duration is unknown.
     */
    public Double timeSavedMs() {
        if (after == null) {
            return null;
        }
        Double beforeDuration = before.metrics().durationMs();
        Double afterDuration = after.metrics().durationMs();
        if (beforeDuration == null || afterDuration == null) {
            return null;
        }
        return beforeDuration - afterDuration;
    }
}
