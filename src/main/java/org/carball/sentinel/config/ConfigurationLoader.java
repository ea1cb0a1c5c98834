package org.carball.sentinel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public ThresholdConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, null, args);
    }

    /**
     * Loads thresholds using the full hierarchy:
     * CLI args > env vars > threshold file > profile > defaults.
     */
    public ThresholdConfig loadConfiguration(String profileName, Path thresholdFile, String[] args) {
        log.debug("Loading configuration");

        ThresholdConfig config = profileName != null ? loadProfile(profileName) : ThresholdConfig.createDefaults();

        if (thresholdFile != null) {
            applyThresholdFile(config, thresholdFile);
        }
        applyEnvironmentVariables(config);
        applyCLIArguments(config, args);

        config.validate();

        log.info("Configuration loaded{}: {}",
                profileName != null ? " with profile '" + profileName + "'" : "", config.getDescription());
        return config;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public ThresholdConfig loadProfile(String profileName) {
        try {
            TuningProfile profile = TuningProfile.fromName(profileName);
            ThresholdConfig thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getDescription());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Reads a YAML threshold file on its own, starting from the defaults.
     */
    public ThresholdConfig loadThresholdFile(Path thresholdFile) {
        ThresholdConfig config = ThresholdConfig.createDefaults();
        applyThresholdFile(config, thresholdFile);
        config.validate();
        return config;
    }

    private void applyThresholdFile(ThresholdConfig config, Path thresholdFile) {
        if (!Files.exists(thresholdFile)) {
            throw new IllegalArgumentException("Threshold config file not found: " + thresholdFile);
        }
        try {
            yamlMapper.readerForUpdating(config).readValue(thresholdFile.toFile());
            log.info("Loaded threshold configuration from: {}", thresholdFile);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read threshold config " + thresholdFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(ThresholdConfig config) {
        Map<String, String> env = environment;

        try {
            if (env.containsKey("SENTINEL_SIGNATURE_LENGTH")) {
                config.setSignatureLength(Integer.parseInt(env.get("SENTINEL_SIGNATURE_LENGTH")));
            }
            if (env.containsKey("SENTINEL_MIN_BASELINE_SAMPLES")) {
                config.setMinBaselineSamples(Integer.parseInt(env.get("SENTINEL_MIN_BASELINE_SAMPLES")));
            }
            if (env.containsKey("SENTINEL_BASELINE_REFRESH_DAYS")) {
                config.setBaselineRefreshIntervalDays(Integer.parseInt(env.get("SENTINEL_BASELINE_REFRESH_DAYS")));
            }
            if (env.containsKey("SENTINEL_BASELINE_LOOKBACK_DAYS")) {
                config.setBaselineLookbackDays(Integer.parseInt(env.get("SENTINEL_BASELINE_LOOKBACK_DAYS")));
            }
            if (env.containsKey("SENTINEL_REGRESSION_MULTIPLIER")) {
                config.setRegressionMultiplier(Double.parseDouble(env.get("SENTINEL_REGRESSION_MULTIPLIER")));
            }
            if (env.containsKey("SENTINEL_ACCELERATION_DURATION_MS")) {
                config.setAccelerationDurationThresholdMs(Long.parseLong(env.get("SENTINEL_ACCELERATION_DURATION_MS")));
            }
            if (env.containsKey("SENTINEL_MEASUREMENT_TOLERANCE_PCT")) {
                config.setMeasurementTolerancePct(Double.parseDouble(env.get("SENTINEL_MEASUREMENT_TOLERANCE_PCT")));
            }
            if (env.containsKey("SENTINEL_BATCH_PARALLELISM")) {
                config.setBatchParallelism(Integer.parseInt(env.get("SENTINEL_BATCH_PARALLELISM")));
            }
            if (env.containsKey("SENTINEL_BATCH_TIMEOUT_SECONDS")) {
                config.setBatchTimeoutSeconds(Long.parseLong(env.get("SENTINEL_BATCH_TIMEOUT_SECONDS")));
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric environment override: {}", e.getMessage());
        }
    }

    private void applyCLIArguments(ThresholdConfig config, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.signature-length":
                        config.setSignatureLength(Integer.parseInt(value));
                        break;
                    case "--thresholds.min-samples":
                        config.setMinBaselineSamples(Integer.parseInt(value));
                        break;
                    case "--thresholds.refresh-days":
                        config.setBaselineRefreshIntervalDays(Integer.parseInt(value));
                        break;
                    case "--thresholds.lookback-days":
                        config.setBaselineLookbackDays(Integer.parseInt(value));
                        break;
                    case "--thresholds.partition-ceiling":
                        config.setPartitionScanRatioCeiling(Double.parseDouble(value));
                        break;
                    case "--thresholds.acceleration-ms":
                        config.setAccelerationDurationThresholdMs(Long.parseLong(value));
                        break;
                    case "--thresholds.hit-ratio-floor":
                        config.setAccelerationHitRatioFloor(Double.parseDouble(value));
                        break;
                    case "--thresholds.fan-out":
                        config.setJoinFanOutMultiplier(Double.parseDouble(value));
                        break;
                    case "--thresholds.small-file-count":
                        config.setSmallFileCountThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.small-file-mb":
                        config.setSmallFileAvgSizeMb(Double.parseDouble(value));
                        break;
                    case "--thresholds.regression":
                        config.setRegressionMultiplier(Double.parseDouble(value));
                        break;
                    case "--thresholds.tolerance":
                        config.setMeasurementTolerancePct(Double.parseDouble(value));
                        break;
                    case "--thresholds.parallelism":
                        config.setBatchParallelism(Integer.parseInt(value));
                        break;
                    case "--thresholds.timeout-seconds":
                        config.setBatchTimeoutSeconds(Long.parseLong(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.signature-length <num>   Hex characters kept from the SQL digest (8-64)
              --thresholds.min-samples <num>        Samples required before a baseline is trusted
              --thresholds.refresh-days <num>       Baseline age that triggers a refresh
              --thresholds.lookback-days <num>      Days of history a baseline is computed from
              --thresholds.partition-ceiling <num>  Scanned/total partition ratio that is flagged
              --thresholds.acceleration-ms <num>    Duration above which missing acceleration is flagged
              --thresholds.hit-ratio-floor <num>    Hit ratio below which a structure is underutilized
              --thresholds.fan-out <num>            Join output/input row ratio that is flagged
              --thresholds.small-file-count <num>   File count above which a dataset is checked
              --thresholds.small-file-mb <num>      Average file size (MB) below which files are small
              --thresholds.regression <num>         Multiple of baseline p95 that counts as regression
              --thresholds.tolerance <num>          Percentage points a fix may fall short of its estimate
              --thresholds.parallelism <num>        Worker threads for batch detection
              --thresholds.timeout-seconds <num>    Overall batch detection timeout

            Environment Variables:
              SENTINEL_SIGNATURE_LENGTH             Same as --thresholds.signature-length
              SENTINEL_MIN_BASELINE_SAMPLES         Same as --thresholds.min-samples
              SENTINEL_BASELINE_REFRESH_DAYS        Same as --thresholds.refresh-days
              SENTINEL_BASELINE_LOOKBACK_DAYS       Same as --thresholds.lookback-days
              SENTINEL_REGRESSION_MULTIPLIER        Same as --thresholds.regression
              SENTINEL_ACCELERATION_DURATION_MS     Same as --thresholds.acceleration-ms
              SENTINEL_MEASUREMENT_TOLERANCE_PCT    Same as --thresholds.tolerance
              SENTINEL_BATCH_PARALLELISM            Same as --thresholds.parallelism
              SENTINEL_BATCH_TIMEOUT_SECONDS        Same as --thresholds.timeout-seconds

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Threshold file (--thresholds <file.yml>)
              4. Profile (--profile <name>) or built-in defaults
            """;
    }
}
