package org.carball.sentinel.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Slf4j
public class ThresholdConfig {

    public static final int MIN_SIGNATURE_LENGTH = 8;
    public static final int MAX_SIGNATURE_LENGTH = 64;

    // Signatures and baselines
    @JsonProperty("signature_length")
    private int signatureLength = 16;

    @JsonProperty("min_baseline_samples")
    private int minBaselineSamples = 20;

    @JsonProperty("baseline_refresh_interval_days")
    private int baselineRefreshIntervalDays = 7;

    @JsonProperty("baseline_lookback_days")
    private int baselineLookbackDays = 30;

    // Partition pruning
    @JsonProperty("partition_floor")
    private int partitionFloor = 1;

    @JsonProperty("partition_scan_ratio_ceiling")
    private double partitionScanRatioCeiling = 0.5;

    // Acceleration structures
    @JsonProperty("acceleration_duration_threshold_ms")
    private long accelerationDurationThresholdMs = 5000;

    @JsonProperty("acceleration_hit_ratio_floor")
    private double accelerationHitRatioFloor = 0.7;

    @JsonProperty("acceleration_missing_improvement_pct")
    private double accelerationMissingImprovementPct = 70.0;

    @JsonProperty("acceleration_underutilized_improvement_pct")
    private double accelerationUnderutilizedImprovementPct = 40.0;

    // Joins and projections
    @JsonProperty("join_fan_out_multiplier")
    private double joinFanOutMultiplier = 10.0;

    @JsonProperty("unbounded_projection_improvement_pct")
    private double unboundedProjectionImprovementPct = 15.0;

    // Storage layout
    @JsonProperty("small_file_count_threshold")
    private long smallFileCountThreshold = 1000;

    @JsonProperty("small_file_avg_size_mb")
    private double smallFileAvgSizeMb = 64.0;

    @JsonProperty("small_file_improvement_pct")
    private double smallFileImprovementPct = 25.0;

    // Regressions
    @JsonProperty("regression_multiplier")
    private double regressionMultiplier = 1.5;

    // Fix validation
    @JsonProperty("measurement_tolerance_pct")
    private double measurementTolerancePct = 20.0;

    // Batch detection
    @JsonProperty("batch_parallelism")
    private int batchParallelism = 4;

    @JsonProperty("batch_timeout_seconds")
    private long batchTimeoutSeconds = 300;

    public static ThresholdConfig createDefaults() {
        return new ThresholdConfig();
    }

    /**
     * Rejects values no detector can work with and warns about values that are legal but unlikely
     * to be intended.
     */
    public void validate() {
        if (signatureLength < MIN_SIGNATURE_LENGTH || signatureLength > MAX_SIGNATURE_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "signature_length must be between %d and %d, got %d",
                    MIN_SIGNATURE_LENGTH, MAX_SIGNATURE_LENGTH, signatureLength));
        }
        if (minBaselineSamples < 1) {
            throw new IllegalArgumentException("min_baseline_samples must be at least 1, got " + minBaselineSamples);
        }
        if (baselineLookbackDays < 1) {
            throw new IllegalArgumentException("baseline_lookback_days must be at least 1, got " + baselineLookbackDays);
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException("batch_parallelism must be at least 1, got " + batchParallelism);
        }
        if (batchTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("batch_timeout_seconds must be positive, got " + batchTimeoutSeconds);
        }
        if (measurementTolerancePct < 0) {
            throw new IllegalArgumentException("measurement_tolerance_pct must not be negative, got " + measurementTolerancePct);
        }

        if (partitionScanRatioCeiling <= 0 || partitionScanRatioCeiling >= 1) {
            log.warn("Partition scan ratio ceiling ({}) outside (0, 1) will flag every or no partitioned scan",
                    partitionScanRatioCeiling);
        }
        if (accelerationHitRatioFloor > 1.0) {
            log.warn("Acceleration hit ratio floor ({}) is above 1.0, every structure will count as underutilized",
                    accelerationHitRatioFloor);
        }
        if (joinFanOutMultiplier <= 1.0) {
            log.warn("Join fan-out multiplier ({}) should be greater than 1.0", joinFanOutMultiplier);
        }
        if (regressionMultiplier <= 1.0) {
            log.warn("Regression multiplier ({}) should be greater than 1.0, otherwise normal p95 runs are flagged",
                    regressionMultiplier);
        }
        if (signatureLength < 12) {
            log.warn("Signature length {} raises the chance of unrelated queries sharing a baseline", signatureLength);
        }

        log.debug("Using thresholds - {}", getDescription());
    }

    @JsonIgnore
    public String getDescription() {
        return String.format(
            "Thresholds: signatureLength=%d, minSamples=%d, refreshDays=%d, lookbackDays=%d, partitionCeiling=%.2f, " +
            "accelerationMs=%d, hitRatioFloor=%.2f, fanOut=%.1f, smallFiles=%d/%.0fMB, regression=%.2f, tolerance=%.1f",
            signatureLength,
            minBaselineSamples,
            baselineRefreshIntervalDays,
            baselineLookbackDays,
            partitionScanRatioCeiling,
            accelerationDurationThresholdMs,
            accelerationHitRatioFloor,
            joinFanOutMultiplier,
            smallFileCountThreshold,
            smallFileAvgSizeMb,
            regressionMultiplier,
            measurementTolerancePct
        );
    }
}
