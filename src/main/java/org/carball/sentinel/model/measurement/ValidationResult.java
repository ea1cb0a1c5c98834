package org.carball.sentinel.model.measurement;

/**
 * Comparison of the measured duration improvement against the improvement that was promised.
 */
public record ValidationResult(
        double estimatedImprovementPct,
        Double actualDurationImprovementPct,
        Double deltaPct,
        double tolerancePct,
        boolean meetsExpectation,
        ValidationOutcome outcome
) {}
