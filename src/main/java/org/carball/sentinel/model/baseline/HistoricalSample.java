package org.carball.sentinel.model.baseline;

/**
 * One historical execution of a signature, as fed into a baseline refresh. Memory and scan sizes
 * are optional.
 */
public record HistoricalSample(
        long durationMs,
        Double memoryMb,
        Double dataScannedMb
) {

    public static HistoricalSample ofDuration(long durationMs) {
        return new HistoricalSample(durationMs, null, null);
    }
}
