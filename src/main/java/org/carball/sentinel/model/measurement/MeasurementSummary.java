package org.carball.sentinel.model.measurement;

/**
 * Aggregate validation statistics over completed measurements in a time window.
 */
public record MeasurementSummary(
        int periodDays,
        int completedCount,
        double averageDurationImprovementPct,
        double successRate,
        double totalTimeSavedMs,
        int exceededCount,
        int underperformedCount
) {

    public static MeasurementSummary empty(int periodDays) {
        return new MeasurementSummary(periodDays, 0, 0.0, 0.0, 0.0, 0, 0);
    }
}
