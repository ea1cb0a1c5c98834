package org.carball.sentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sentinel.config.ConfigurationLoader;
import org.carball.sentinel.config.OutputFormat;
import org.carball.sentinel.config.SentinelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuerySentinelCLITest {

    @TempDir
    Path tempDir;

    private Path export;
    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        export = tempDir.resolve("telemetry-export.json");
        try (InputStream in = getClass().getResourceAsStream("/telemetry-export.json")) {
            Files.copy(in, export);
        }
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldWriteJsonAndMarkdownReports() throws IOException {
        // Given
        String base = tempDir.resolve("report").toString();

        // When
        int exitCode = QuerySentinelCLI.run(new String[]{export.toString(), "--output", base, "--format", "both"}, loader);

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("report.json")).exists();
        assertThat(tempDir.resolve("report.md")).exists();

        JsonNode json = new ObjectMapper().readTree(tempDir.resolve("report.json").toFile());
        assertThat(json.get("reportMetadata").get("executionsAnalyzed").asInt()).isEqualTo(3);
        List<String> failed = new ArrayList<>();
        json.get("failedLookups").forEach(id -> failed.add(id.asText()));
        assertThat(failed).containsExactlyInAnyOrder("exec-4", "exec-5");

        List<String> exec1Types = new ArrayList<>();
        json.get("executions").get(0).get("findings").forEach(f -> exec1Types.add(f.get("issueType").asText()));
        assertThat(exec1Types).contains("PARTITION_SCAN", "JOIN_FAN_OUT", "ACCELERATION_UNDERUTILIZED",
                "SMALL_FILES", "UNBOUNDED_PROJECTION");

        assertThat(json.get("datasetFindings").size()).isEqualTo(1);
        assertThat(Files.readString(tempDir.resolve("report.md"))).contains("# Query Performance Findings Report");
    }

    @Test
    void shouldApplyFormatExtensionAndProfile() {
        String output = tempDir.resolve("findings.json").toString();

        SentinelConfig config = QuerySentinelCLI.parseArgs(
                new String[]{export.toString(), "-o", output, "-f", "markdown", "--profile", "conservative", "-v"},
                loader);

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(config.getOutputFile()).endsWith("findings.md");
        assertThat(config.isVerbose()).isTrue();
        assertThat(config.getThresholdConfig().getMinBaselineSamples()).isEqualTo(50);
    }

    @Test
    void shouldPassThresholdOverridesToLoader() {
        SentinelConfig config = QuerySentinelCLI.parseArgs(
                new String[]{export.toString(), "--thresholds.fan-out", "25", "-o", tempDir.resolve("r").toString()},
                loader);

        assertThat(config.getThresholdConfig().getJoinFanOutMultiplier()).isEqualTo(25.0);
    }

    @Test
    void shouldRejectUnknownOptionsAndBadFormats() {
        assertThatThrownBy(() -> QuerySentinelCLI.parseArgs(new String[]{export.toString(), "--bogus"}, loader))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --bogus");
        assertThatThrownBy(() -> QuerySentinelCLI.parseArgs(new String[]{export.toString(), "-f", "xml"}, loader))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldRejectMissingTelemetryFile() {
        String missing = tempDir.resolve("nope.json").toString();

        assertThatThrownBy(() -> QuerySentinelCLI.parseArgs(new String[]{missing}, loader))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Telemetry export file not found");
    }

    @Test
    void shouldStripOnlyFileExtensions() {
        assertThat(QuerySentinelCLI.removeFileExtension("out/report.json")).isEqualTo("out/report");
        assertThat(QuerySentinelCLI.removeFileExtension("out.d/report")).isEqualTo("out.d/report");
        assertThat(QuerySentinelCLI.removeFileExtension("report")).isEqualTo("report");
    }
}
