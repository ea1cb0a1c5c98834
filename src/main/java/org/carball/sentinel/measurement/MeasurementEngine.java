package org.carball.sentinel.measurement;

import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.exception.NotFoundException;
import org.carball.sentinel.exception.SequencingException;
import org.carball.sentinel.model.measurement.ExecutionMetrics;
import org.carball.sentinel.model.measurement.MeasuredMetric;
import org.carball.sentinel.model.measurement.Measurement;
import org.carball.sentinel.model.measurement.MeasurementSummary;
import org.carball.sentinel.model.measurement.MetricSnapshot;
import org.carball.sentinel.model.measurement.ValidationOutcome;
import org.carball.sentinel.model.measurement.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-phase before/after measurement of an applied recommendation.
 *
 * <p>{@link #recordBefore} captures the baseline execution and may only happen once per
 * recommendation. {@link #recordAfter} captures the execution after the fix, computes per-metric
 * improvements and validates the duration improvement against the estimate. Calling it again
 * replaces the previous after snapshot.
 */
@Slf4j
public class MeasurementEngine {

    private final ExecutionMetricsLookup metricsLookup;
    private final MeasurementStore store;
    private final double tolerancePct;
    private final Clock clock;

    public MeasurementEngine(ExecutionMetricsLookup metricsLookup, MeasurementStore store, ThresholdConfig thresholds) {
        this(metricsLookup, store, thresholds, Clock.systemUTC());
    }

    public MeasurementEngine(ExecutionMetricsLookup metricsLookup, MeasurementStore store,
                             ThresholdConfig thresholds, Clock clock) {
        this.metricsLookup = metricsLookup;
        this.store = store;
        this.tolerancePct = thresholds.getMeasurementTolerancePct();
        this.clock = clock;
    }

    public Measurement recordBefore(String recommendationId, String executionId) {
        requireId(recommendationId, "recommendationId");
        ExecutionMetrics metrics = lookup(executionId);

        if (store.find(recommendationId).isPresent()) {
            throw new SequencingException(recommendationId,
                    "A measurement already exists for recommendation " + recommendationId);
        }

        Instant now = clock.instant();
        Measurement measurement = Measurement.builder()
                .recommendationId(recommendationId)
                .before(new MetricSnapshot(executionId, metrics, now))
                .improvements(Collections.emptyMap())
                .createdAt(now)
                .build();

        // a concurrent caller may have won between the check above and this insert
        if (!store.insertIfAbsent(measurement)) {
            throw new SequencingException(recommendationId,
                    "A measurement already exists for recommendation " + recommendationId);
        }

        log.info("Recorded before snapshot for recommendation {} from execution {}", recommendationId, executionId);
        return measurement;
    }

    public Measurement recordAfter(String recommendationId, String executionId, double estimatedImprovementPct) {
        requireId(recommendationId, "recommendationId");
        Measurement existing = store.find(recommendationId)
                .orElseThrow(() -> new SequencingException(recommendationId,
                        "No before snapshot recorded for recommendation " + recommendationId));

        ExecutionMetrics afterMetrics = lookup(executionId);

        if (existing.getAfter() != null) {
            log.info("Overwriting after snapshot for recommendation {} (was execution {}, now {})",
                    recommendationId, existing.getAfter().executionId(), executionId);
        }

        Map<MeasuredMetric, Double> improvements = computeImprovements(existing.getBefore().metrics(), afterMetrics);
        ValidationResult validation = validate(improvements.get(MeasuredMetric.DURATION), estimatedImprovementPct);

        Instant now = clock.instant();
        Measurement completed = existing.toBuilder()
                .after(new MetricSnapshot(executionId, afterMetrics, now))
                .improvements(Collections.unmodifiableMap(improvements))
                .validation(validation)
                .measuredAt(now)
                .build();
        store.replace(completed);

        log.info("Recorded after snapshot for recommendation {}: duration improvement {}% vs estimated {}% -> {}",
                recommendationId, validation.actualDurationImprovementPct(), estimatedImprovementPct, validation.outcome());
        return completed;
    }

    public Optional<Measurement> find(String recommendationId) {
        return store.find(recommendationId);
    }

    public MeasurementSummary summarize(int periodDays) {
        if (periodDays <= 0) {
            throw new IllegalArgumentException("Period must be at least one day, got " + periodDays);
        }
        Instant since = clock.instant().minus(Duration.ofDays(periodDays));
        List<Measurement> completed = store.findCompletedSince(since);
        if (completed.isEmpty()) {
            return MeasurementSummary.empty(periodDays);
        }

        double improvementSum = 0.0;
        int improvementCount = 0;
        int successes = 0;
        double timeSaved = 0.0;
        int exceeded = 0;
        int underperformed = 0;

        for (Measurement measurement : completed) {
            ValidationResult validation = measurement.getValidation();
            if (validation.actualDurationImprovementPct() != null) {
                improvementSum += validation.actualDurationImprovementPct();
                improvementCount++;
            }
            if (validation.meetsExpectation()) {
                successes++;
            }
            Double saved = measurement.timeSavedMs();
            if (saved != null) {
                timeSaved += saved;
            }
            if (validation.outcome() == ValidationOutcome.EXCEEDED) {
                exceeded++;
            } else if (validation.outcome() == ValidationOutcome.UNDERPERFORMED) {
                underperformed++;
            }
        }

        return new MeasurementSummary(
                periodDays,
                completed.size(),
                improvementCount == 0 ? 0.0 : round(improvementSum / improvementCount),
                round((double) successes / completed.size()),
                timeSaved,
                exceeded,
                underperformed);
    }

    /**
     * Percentage reduction per metric. Metrics whose before value is unknown or zero are skipped.
     */
    static Map<MeasuredMetric, Double> computeImprovements(ExecutionMetrics before, ExecutionMetrics after) {
        Map<MeasuredMetric, Double> improvements = new EnumMap<>(MeasuredMetric.class);
        for (MeasuredMetric metric : MeasuredMetric.values()) {
            Double beforeValue = before.valueOf(metric);
            Double afterValue = after.valueOf(metric);
            if (beforeValue == null || beforeValue == 0.0 || afterValue == null) {
                continue;
            }
            improvements.put(metric, round((beforeValue - afterValue) / beforeValue * 100.0));
        }
        return improvements;
    }

    private ValidationResult validate(Double actualDurationImprovementPct, double estimatedImprovementPct) {
        if (actualDurationImprovementPct == null) {
            return new ValidationResult(estimatedImprovementPct, null, null, tolerancePct,
                    false, ValidationOutcome.INCONCLUSIVE);
        }
        boolean meets = actualDurationImprovementPct >= estimatedImprovementPct - tolerancePct;
        double delta = round(actualDurationImprovementPct - estimatedImprovementPct);

        ValidationOutcome outcome;
        if (!meets) {
            outcome = ValidationOutcome.UNDERPERFORMED;
        } else if (actualDurationImprovementPct >= estimatedImprovementPct) {
            outcome = ValidationOutcome.EXCEEDED;
        } else {
            outcome = ValidationOutcome.MET;
        }
        return new ValidationResult(estimatedImprovementPct, actualDurationImprovementPct, delta, tolerancePct, meets, outcome);
    }

    private ExecutionMetrics lookup(String executionId) {
        requireId(executionId, "executionId");
        return metricsLookup.findMetrics(executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
