package org.carball.sentinel.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.analyzer.BatchDetectionResult;
import org.carball.sentinel.analyzer.QuerySentinel;
import org.carball.sentinel.baseline.InMemoryBaselineStore;
import org.carball.sentinel.config.ConfigurationLoader;
import org.carball.sentinel.config.OutputFormat;
import org.carball.sentinel.config.SentinelConfig;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.config.TuningProfile;
import org.carball.sentinel.exception.NotFoundException;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.output.DetectionReport;
import org.carball.sentinel.parser.TelemetryFileConnector;
import org.carball.sentinel.signature.Signature;
import org.carball.sentinel.signature.SignatureGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class QuerySentinelCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Query Sentinel: Performance Anti-Patterns v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            System.exit(run(args, new ConfigurationLoader()));
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.error("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    /**
     * Runs a full analysis of one telemetry export and writes the report.
     *
     * @return the process exit code
     */
    static int run(String[] args, ConfigurationLoader loader) throws IOException {
        SentinelConfig config = parseArgs(args, loader);

        System.out.println("\n🔍 Starting analysis...");
        System.out.println("   Telemetry export: " + config.getTelemetryFile());
        if (config.getProfileName() != null) {
            System.out.println("   Profile: " + config.getProfileName());
        }
        System.out.println("   Output: " + String.join(", ", outputFiles(config)));
        System.out.println();

        System.out.print("📥 Loading telemetry export... ");
        TelemetryFileConnector connector = new TelemetryFileConnector(config.getTelemetryFile());
        System.out.println("✓");
        if (config.isVerbose()) {
            TelemetryFileConnector.ExportMetadata metadata = connector.getExportMetadata();
            System.out.println("     - Engine: " + metadata.engine());
            System.out.println("     - Export timestamp: " + metadata.exportTimestamp());
            System.out.println("     - Executions: " + connector.getExecutions().size());
            System.out.println("     - Datasets: " + connector.getDatasets().size());
            System.out.println("     - Acceleration structures: " + connector.getAccelerations().size());
        }

        ThresholdConfig thresholds = config.getThresholdConfig();
        SignatureGenerator signatureGenerator = new SignatureGenerator(thresholds.getSignatureLength());
        // baseline history ends when the export was taken, not when the export is analyzed
        Clock exportClock = Clock.fixed(connector.getExportInstant().orElseGet(Instant::now), ZoneOffset.UTC);
        QuerySentinel sentinel = QuerySentinel.builder()
                .thresholds(thresholds)
                .baselineStore(new InMemoryBaselineStore())
                .sampleProvider(connector.historicalSamples(signatureGenerator, thresholds.getBaselineLookbackDays(), exportClock))
                .auxiliaryProvider(connector)
                .metricsLookup(connector)
                .build();

        System.out.print("📈 Computing baselines... ");
        List<Baseline> baselines = refreshBaselines(sentinel, connector.getExecutions());
        System.out.println("✓");
        if (config.isVerbose()) {
            long trusted = baselines.stream()
                    .filter(b -> b.sampleCount() >= thresholds.getMinBaselineSamples())
                    .count();
            System.out.println("     - Signatures with baselines: " + baselines.size());
            System.out.println("     - Baselines with enough samples for regression checks: " + trusted);
        }

        System.out.print("🔎 Detecting anti-patterns... ");
        BatchDetectionResult result = sentinel.detectBatch(connector.getExecutions(), connector);
        List<Finding> datasetFindings = sentinel.auditDatasets(connector.getDatasets());
        System.out.println(result.completed() ? "✓" : "⚠ (timed out)");

        System.out.print("📝 Writing results... ");
        writeResults(new DetectionReport(result, datasetFindings, baselines), config);
        System.out.println("✓");

        printSummary(result, datasetFindings);

        System.out.println("\n✅ Analysis complete!");
        System.out.println("   Output files:");
        outputFiles(config).forEach(file -> System.out.println("     - " + file));

        if (result.totalFindings() == 0 && datasetFindings.isEmpty()) {
            System.out.println("\n💡 No anti-patterns found.");
        }
        return result.completed() ? 0 : 2;
    }

    private static List<Baseline> refreshBaselines(QuerySentinel sentinel, List<ExecutionRecord> executions) {
        Set<Signature> signatures = new LinkedHashSet<>();
        for (ExecutionRecord record : executions) {
            try {
                signatures.add(sentinel.computeSignature(record.sqlText()));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping execution {} without SQL text", record.executionId());
            }
        }

        List<Baseline> baselines = new ArrayList<>();
        for (Signature signature : signatures) {
            try {
                baselines.add(sentinel.getOrRefreshBaseline(signature));
            } catch (NotFoundException e) {
                log.debug("No completed executions for signature {}", signature);
            }
        }
        log.info("Computed {} baselines for {} signatures", baselines.size(), signatures.size());
        return baselines;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar query-sentinel.jar <telemetry-export.json> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  telemetry-export    JSON file with exported executions, profiles and storage metadata");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: sentinel-report.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --thresholds        YAML file with custom detection thresholds (optional)");
        System.out.println("  --profile           Threshold profile: " + TuningProfile.getAvailableProfiles());
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(TuningProfile.getProfileHelp());
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println("Examples:");
        System.out.println("  # Basic analysis");
        System.out.println("  java -jar query-sentinel.jar telemetry-export.json");
        System.out.println();
        System.out.println("  # Markdown and JSON report with aggressive thresholds");
        System.out.println("  java -jar query-sentinel.jar telemetry-export.json --profile aggressive --format both");
        System.out.println();
        System.out.println("  # Use custom thresholds");
        System.out.println("  java -jar query-sentinel.jar telemetry-export.json --thresholds my-thresholds.yml");
    }

    static SentinelConfig parseArgs(String[] args, ConfigurationLoader loader) {
        SentinelConfig config = new SentinelConfig();
        config.setTelemetryFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("sentinel-report.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        // Parse optional arguments
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--thresholds":
                    config.setThresholdFile(Paths.get(requireValue(args, ++i, "Threshold config file not specified")));
                    break;

                case "--profile":
                    config.setProfileName(requireValue(args, ++i, "Profile name not specified"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (arg.startsWith("--thresholds.")) {
                        // Value is applied by ConfigurationLoader
                        requireValue(args, ++i, "Value not specified for " + arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        config.setOutputFile(baseFileName + (config.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        config.setThresholdConfig(loader.loadConfiguration(config.getProfileName(), config.getThresholdFile(), args));

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(SentinelConfig config) {
        if (!Files.exists(config.getTelemetryFile())) {
            throw new IllegalArgumentException("Telemetry export file not found: " + config.getTelemetryFile());
        }

        if (!config.getTelemetryFile().toString().endsWith(".json")) {
            throw new IllegalArgumentException("Telemetry export must be a .json file");
        }

        Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static List<String> outputFiles(SentinelConfig config) {
        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (config.getOutputFormat()) {
            case BOTH:
                return List.of(baseFileName + ".json", baseFileName + ".md");
            case MARKDOWN:
            case JSON:
            default:
                return List.of(config.getOutputFile());
        }
    }

    private static void writeResults(DetectionReport report, SentinelConfig config) throws IOException {
        for (String file : outputFiles(config)) {
            String content = file.endsWith(".md") ? report.toMarkdown() : report.toJson();
            Files.writeString(Paths.get(file), content);
            log.info("Wrote report to {}", file);
        }
    }

    private static void printSummary(BatchDetectionResult result, List<Finding> datasetFindings) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nExecutions analyzed: " + result.analyzedCount());
        System.out.println("Failed profile lookups: " + result.failedLookupCount());
        if (result.skipped() > 0) {
            System.out.println("Skipped (deadline): " + result.skipped());
        }
        System.out.println("Execution findings: " + result.totalFindings());
        System.out.println("Dataset findings: " + datasetFindings.size());

        Map<IssueType, Long> byType = Stream.concat(
                        result.findingsByExecutionId().values().stream().flatMap(List::stream),
                        datasetFindings.stream())
                .collect(Collectors.groupingBy(Finding::getIssueType, TreeMap::new, Collectors.counting()));
        if (!byType.isEmpty()) {
            System.out.println("\nFindings by type:");
            byType.forEach((type, count) ->
                    System.out.println("  • " + type.getDefaultTitle() + ": " + count));
        }
    }
}
