package org.carball.sentinel.config;

import lombok.Getter;

@Getter
public enum TuningProfile {

    CONSERVATIVE("conservative", "Only flag clear-cut problems on long-running queries",
            0.75, 20.0, 2.0, 15000, 50),

    BALANCED("balanced", "Default settings for most workloads",
            0.5, 10.0, 1.5, 5000, 20),

    AGGRESSIVE("aggressive", "Flag more optimization opportunities, tolerate some noise",
            0.3, 5.0, 1.25, 2000, 10),

    DISCOVERY("discovery", "Surface every potential pattern on small or new workloads",
            0.2, 3.0, 1.1, 1000, 5) {
        @Override
        public ThresholdConfig buildThresholds() {
            ThresholdConfig config = super.buildThresholds();
            config.setSmallFileCountThreshold(200);
            config.setBaselineRefreshIntervalDays(1);
            return config;
        }
    };

    private final String name;
    private final String description;
    private final double partitionScanRatioCeiling;
    private final double joinFanOutMultiplier;
    private final double regressionMultiplier;
    private final long accelerationDurationThresholdMs;
    private final int minBaselineSamples;

    TuningProfile(String name, String description,
                  double partitionScanRatioCeiling, double joinFanOutMultiplier, double regressionMultiplier,
                  long accelerationDurationThresholdMs, int minBaselineSamples) {
        this.name = name;
        this.description = description;
        this.partitionScanRatioCeiling = partitionScanRatioCeiling;
        this.joinFanOutMultiplier = joinFanOutMultiplier;
        this.regressionMultiplier = regressionMultiplier;
        this.accelerationDurationThresholdMs = accelerationDurationThresholdMs;
        this.minBaselineSamples = minBaselineSamples;
    }

    /**
     * Creates a threshold set with this profile's sensitivity applied on top of the defaults.
     */
    public ThresholdConfig buildThresholds() {
        ThresholdConfig config = ThresholdConfig.createDefaults();
        config.setPartitionScanRatioCeiling(partitionScanRatioCeiling);
        config.setJoinFanOutMultiplier(joinFanOutMultiplier);
        config.setRegressionMultiplier(regressionMultiplier);
        config.setAccelerationDurationThresholdMs(accelerationDurationThresholdMs);
        config.setMinBaselineSamples(minBaselineSamples);
        return config;
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static TuningProfile fromName(String name) {
        for (TuningProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown tuning profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (TuningProfile profile : values()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Tuning Profiles:\n\n");
        for (TuningProfile profile : values()) {
            help.append(String.format("  %-15s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
