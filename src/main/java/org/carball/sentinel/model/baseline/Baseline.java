package org.carball.sentinel.model.baseline;

import java.time.Instant;

/**
 * Percentile statistics of historical duration for one query signature. A baseline only exists
 * for at least one sample.
 */
public record Baseline(
        String signature,
        int sampleCount,
        double minDurationMs,
        double maxDurationMs,
        double meanDurationMs,
        double p50DurationMs,
        double p95DurationMs,
        double p99DurationMs,
        Double medianMemoryMb,
        Double medianDataScannedMb,
        Instant firstSeen,
        Instant lastUpdated
) {

    public Baseline {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("Baseline requires a signature");
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("Baseline requires at least one sample, got " + sampleCount);
        }
    }

    public Baseline withFirstSeen(Instant firstSeen) {
        return new Baseline(signature, sampleCount, minDurationMs, maxDurationMs, meanDurationMs,
                p50DurationMs, p95DurationMs, p99DurationMs, medianMemoryMb, medianDataScannedMb,
                firstSeen, lastUpdated);
    }
}
