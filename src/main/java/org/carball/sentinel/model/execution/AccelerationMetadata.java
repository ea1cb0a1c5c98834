package org.carball.sentinel.model.execution;

import java.time.Instant;

/**
 * A precomputed acceleration structure (materialized result set) and its historical usage.
 */
public record AccelerationMetadata(
        String accelerationId,
        String name,
        String type,
        String datasetPath,
        long hitCount,
        long missCount,
        Instant lastUsed
) {

    /**
     * Fraction of matching queries this structure actually answered; 0 when it was never considered.
     */
    public double hitRatio() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
