package org.carball.sentinel.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class SentinelConfig {
    private Path telemetryFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String profileName;
    private Path thresholdFile;
    private boolean verbose;
    private ThresholdConfig thresholdConfig;
}
