package org.carball.sentinel.baseline;

import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.baseline.HistoricalSample;
import org.carball.sentinel.signature.Signature;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds duration baselines per signature and keeps the {@link BaselineStore} fresh.
 *
 * <p>Percentiles use linear interpolation between the two nearest ranks of the sorted samples:
 * {@code rank = p / 100 * (n - 1)}.
 */
@Slf4j
public class BaselineCalculator {

    static final int LOCK_STRIPES = 64;

    private final BaselineStore store;
    private final int minSamples;
    private final Duration refreshInterval;
    private final Clock clock;
    private final Object[] refreshLocks = new Object[LOCK_STRIPES];

    public BaselineCalculator(BaselineStore store, ThresholdConfig thresholds) {
        this(store, thresholds, Clock.systemUTC());
    }

    public BaselineCalculator(BaselineStore store, ThresholdConfig thresholds, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.minSamples = thresholds.getMinBaselineSamples();
        this.refreshInterval = Duration.ofDays(thresholds.getBaselineRefreshIntervalDays());
        this.clock = clock;
        for (int i = 0; i < refreshLocks.length; i++) {
            refreshLocks[i] = new Object();
        }
    }

    public Optional<Baseline> computeBaseline(Signature signature, List<Long> durationSamples) {
        if (durationSamples == null || durationSamples.isEmpty()) {
            return Optional.empty();
        }
        double[] sorted = durationSamples.stream()
                .mapToDouble(Long::doubleValue)
                .sorted()
                .toArray();
        Instant now = clock.instant();
        return Optional.of(buildBaseline(signature, sorted, null, null, now));
    }

    /**
     * Same duration statistics as {@link #computeBaseline(Signature, List)}, plus medians of memory
     * and data scanned over the samples that report them.
     */
    public Optional<Baseline> computeBaselineFromSamples(Signature signature, List<HistoricalSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return Optional.empty();
        }
        double[] sorted = samples.stream()
                .mapToDouble(HistoricalSample::durationMs)
                .sorted()
                .toArray();
        Double medianMemory = medianOf(samples, HistoricalSample::memoryMb);
        Double medianScanned = medianOf(samples, HistoricalSample::dataScannedMb);
        return Optional.of(buildBaseline(signature, sorted, medianMemory, medianScanned, clock.instant()));
    }

    /**
     * Returns the stored baseline, refreshing it first when it is missing, undersampled or older
     * than the refresh interval. Refreshes of one signature never run concurrently.
     */
    public Optional<Baseline> getOrRefresh(Signature signature, HistoricalSampleProvider sampleProvider) {
        Optional<Baseline> existing = store.get(signature);
        if (existing.isPresent() && !needsRefresh(existing.get())) {
            return existing;
        }

        synchronized (lockFor(signature)) {
            // another thread may have refreshed while this one waited
            Optional<Baseline> current = store.get(signature);
            if (current.isPresent() && !needsRefresh(current.get())) {
                return current;
            }

            List<HistoricalSample> samples = sampleProvider.samplesFor(signature);
            Optional<Baseline> refreshed = computeBaselineFromSamples(signature, samples);
            if (refreshed.isEmpty()) {
                log.debug("No samples available for signature {}, keeping existing baseline", signature);
                return current;
            }

            Baseline baseline = refreshed.get();
            if (current.isPresent() && current.get().firstSeen() != null) {
                baseline = baseline.withFirstSeen(current.get().firstSeen());
            }
            store.put(signature, baseline);
            log.info("Refreshed baseline for signature {}: {} samples, p95={}ms",
                    signature, baseline.sampleCount(), baseline.p95DurationMs());
            return Optional.of(baseline);
        }
    }

    /**
     * Signatures share a fixed set of stripes, so distinct signatures may occasionally wait on each other.
     */
    Object lockFor(Signature signature) {
        return refreshLocks[Math.floorMod(signature.hashCode(), refreshLocks.length)];
    }

    public boolean needsRefresh(Baseline baseline) {
        if (baseline.sampleCount() < minSamples) {
            return true;
        }
        Instant lastUpdated = baseline.lastUpdated();
        return lastUpdated == null || Duration.between(lastUpdated, clock.instant()).compareTo(refreshInterval) > 0;
    }

    /**
     * Linear-interpolation percentile of an ascending array.
     */
    public static double percentile(double[] sortedValues, double p) {
        if (sortedValues == null || sortedValues.length == 0) {
            throw new IllegalArgumentException("Percentile requires at least one value");
        }
        if (p < 0 || p > 100 || Double.isNaN(p)) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got " + p);
        }
        double rank = p / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double fraction = rank - lower;
        return sortedValues[lower] + (sortedValues[upper] - sortedValues[lower]) * fraction;
    }

    private static Baseline buildBaseline(Signature signature, double[] sorted,
                                          Double medianMemory, Double medianScanned, Instant now) {
        double mean = Arrays.stream(sorted).average().orElse(0.0);
        return new Baseline(
                signature.value(),
                sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                mean,
                percentile(sorted, 50),
                percentile(sorted, 95),
                percentile(sorted, 99),
                medianMemory,
                medianScanned,
                now,
                now);
    }

    private static Double medianOf(List<HistoricalSample> samples, Function<HistoricalSample, Double> extractor) {
        List<Double> known = new ArrayList<>();
        for (HistoricalSample sample : samples) {
            Double value = extractor.apply(sample);
            if (value != null) {
                known.add(value);
            }
        }
        if (known.isEmpty()) {
            return null;
        }
        double[] sorted = known.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        return percentile(sorted, 50);
    }
}
