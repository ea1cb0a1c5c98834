package org.carball.sentinel.parser;

import org.carball.sentinel.baseline.HistoricalSampleProvider;
import org.carball.sentinel.exception.ProfileLookupException;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.execution.ExecutionStatus;
import org.carball.sentinel.model.execution.OperatorType;
import org.carball.sentinel.model.measurement.ExecutionMetrics;
import org.carball.sentinel.signature.SignatureGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryFileConnectorTest {

    @TempDir
    Path tempDir;

    private TelemetryFileConnector connector;

    @BeforeEach
    void setUp() throws IOException, URISyntaxException {
        Path export = Path.of(getClass().getResource("/telemetry-export.json").toURI());
        connector = new TelemetryFileConnector(export);
    }

    @Test
    void shouldReturnCorrectMetadata() {
        // When
        TelemetryFileConnector.ExportMetadata metadata = connector.getExportMetadata();

        // Then
        assertThat(metadata.engine()).isEqualTo("dremio");
        assertThat(metadata.exportTimestamp()).isEqualTo("2025-06-01T10:30:00Z");
        assertThat(metadata.totalExecutions()).isEqualTo(5);
    }

    @Test
    void shouldLoadExecutionsInExportOrder() {
        List<ExecutionRecord> executions = connector.getExecutions();

        assertThat(executions).extracting(ExecutionRecord::executionId)
                .containsExactly("exec-1", "exec-2", "exec-3", "exec-4", "exec-5");

        ExecutionRecord first = executions.get(0);
        assertThat(first.durationMs()).isEqualTo(42_000);
        assertThat(first.queueName()).isEqualTo("reporting");
        assertThat(first.startTime()).isEqualTo(Instant.parse("2025-06-01T09:00:00Z"));
        assertThat(first.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(executions.get(2).status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(executions.get(2).startTime()).isNull();
    }

    @Test
    void shouldParseProfile() throws ProfileLookupException {
        // When
        Optional<ExecutionProfile> profile = connector.findProfile(connector.getExecution("exec-1").orElseThrow());

        // Then
        assertThat(profile).isPresent();
        assertThat(profile.get().getPartitionsScanned()).isEqualTo(365);
        assertThat(profile.get().getPartitionsTotal()).isEqualTo(365);
        assertThat(profile.get().getBytesScanned()).isEqualTo(1_073_741_824L);
        assertThat(profile.get().isAccelerationUsed()).isFalse();
        assertThat(profile.get().getDatasetPaths()).containsExactly("lake.sales.orders");
        assertThat(profile.get().getOperators()).extracting(op -> op.type())
                .containsExactly(OperatorType.SCAN, OperatorType.JOIN);
    }

    @Test
    void shouldReturnEmptyProfileWhenAbsent() throws ProfileLookupException {
        assertThat(connector.findProfile(connector.getExecution("exec-2").orElseThrow())).isEmpty();
    }

    @Test
    void shouldFailLookupForMalformedProfiles() {
        ExecutionRecord notAnObject = connector.getExecution("exec-4").orElseThrow();
        ExecutionRecord badCounter = connector.getExecution("exec-5").orElseThrow();

        assertThatThrownBy(() -> connector.findProfile(notAnObject))
                .isInstanceOf(ProfileLookupException.class)
                .hasMessageContaining("exec-4");
        assertThatThrownBy(() -> connector.findProfile(badCounter))
                .isInstanceOf(ProfileLookupException.class)
                .hasMessageContaining("exec-5");
    }

    @Test
    void shouldProvideAuxiliaryMetadataForProfileDatasets() throws ProfileLookupException {
        ExecutionRecord record = connector.getExecution("exec-1").orElseThrow();
        ExecutionProfile profile = connector.findProfile(record).orElseThrow();

        AuxiliaryMetadata auxiliary = connector.metadataFor(record, profile);

        assertThat(auxiliary.datasets()).extracting(d -> d.datasetPath()).containsExactly("lake.sales.orders");
        assertThat(auxiliary.accelerations()).extracting(a -> a.accelerationId()).containsExactly("acc-1");
        assertThat(connector.metadataFor(record, null)).isEqualTo(AuxiliaryMetadata.empty());
    }

    @Test
    void shouldProvideExecutionMetrics() {
        ExecutionMetrics metrics = connector.findMetrics("exec-1").orElseThrow();

        assertThat(metrics.durationMs()).isEqualTo(42_000.0);
        assertThat(metrics.memoryMb()).isEqualTo(2_048.0);
        assertThat(metrics.dataScannedMb()).isEqualTo(1_024.0);
        assertThat(metrics.cpuTimeMs()).isEqualTo(180_000.0);
    }

    @Test
    void shouldFallBackToDurationWhenProfileIsBroken() {
        ExecutionMetrics metrics = connector.findMetrics("exec-4").orElseThrow();

        assertThat(metrics.durationMs()).isEqualTo(800.0);
        assertThat(metrics.memoryMb()).isNull();
        assertThat(connector.findMetrics("unknown")).isEmpty();
    }

    @Test
    void shouldGroupCompletedExecutionsBySignature() {
        // Given
        SignatureGenerator generator = new SignatureGenerator();
        Clock exportTime = Clock.fixed(Instant.parse("2025-06-01T10:30:00Z"), ZoneOffset.UTC);
        HistoricalSampleProvider samples = connector.historicalSamples(generator, 30, exportTime);

        // When & Then
        assertThat(samples.samplesFor(generator.computeSignature("SELECT * FROM lake.sales.orders WHERE region = 'X'")))
                .extracting(sample -> sample.durationMs())
                .containsExactly(42_000L, 3_000L);
        assertThat(samples.samplesFor(generator.computeSignature("SELECT id FROM lake.hr.people"))).isEmpty();
    }

    @Test
    void shouldLeaveExecutionsOutsideLookbackWindowOutOfBaselineHistory() throws IOException {
        // Given
        Path export = tempDir.resolve("history.json");
        Files.writeString(export, """
                {
                  "export_metadata": { "export_timestamp": "2025-06-01T00:00:00Z" },
                  "executions": [
                    { "execution_id": "old", "sql_text": "SELECT id FROM t WHERE x = 1", "duration_ms": 9000,
                      "start_time": "2025-04-01T00:00:00Z", "status": "COMPLETED" },
                    { "execution_id": "recent", "sql_text": "SELECT id FROM t WHERE x = 2", "duration_ms": 1000,
                      "start_time": "2025-05-25T00:00:00Z", "status": "COMPLETED" },
                    { "execution_id": "undated", "sql_text": "SELECT id FROM t WHERE x = 3", "duration_ms": 2000,
                      "status": "COMPLETED" }
                  ]
                }
                """);
        TelemetryFileConnector historyConnector = new TelemetryFileConnector(export);
        SignatureGenerator generator = new SignatureGenerator();
        Clock exportTime = Clock.fixed(historyConnector.getExportInstant().orElseThrow(), ZoneOffset.UTC);

        // When
        HistoricalSampleProvider lastMonth = historyConnector.historicalSamples(generator, 30, exportTime);
        HistoricalSampleProvider lastQuarter = historyConnector.historicalSamples(generator, 90, exportTime);

        // Then
        assertThat(lastMonth.samplesFor(generator.computeSignature("SELECT id FROM t WHERE x = 0")))
                .extracting(sample -> sample.durationMs())
                .containsExactly(1_000L, 2_000L);
        assertThat(lastQuarter.samplesFor(generator.computeSignature("SELECT id FROM t WHERE x = 0")))
                .extracting(sample -> sample.durationMs())
                .containsExactly(9_000L, 1_000L, 2_000L);
    }

    @Test
    void shouldFallBackToDurationWhenProfileCounterOverflows() throws IOException {
        // Given
        Path export = tempDir.resolve("overflow.json");
        Files.writeString(export, """
                {
                  "export_metadata": { "export_timestamp": "2025-06-01T00:00:00Z" },
                  "executions": [
                    { "execution_id": "huge", "sql_text": "SELECT * FROM t", "duration_ms": 4000,
                      "status": "COMPLETED",
                      "profile": { "partitions_total": 9999999999, "memory_allocated_bytes": 1048576 } }
                  ]
                }
                """);
        TelemetryFileConnector overflowConnector = new TelemetryFileConnector(export);
        ExecutionRecord record = overflowConnector.getExecution("huge").orElseThrow();

        // When
        ExecutionMetrics metrics = overflowConnector.findMetrics("huge").orElseThrow();

        // Then
        assertThatThrownBy(() -> overflowConnector.findProfile(record))
                .isInstanceOf(ProfileLookupException.class)
                .hasMessageContaining("Malformed profile for execution huge");
        assertThat(metrics.durationMs()).isEqualTo(4000.0);
        assertThat(metrics.memoryMb()).isNull();
    }

    @Test
    void shouldThrowExceptionForMissingFile() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> new TelemetryFileConnector(missing))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Telemetry export file not found");
    }

    @Test
    void shouldThrowExceptionForInvalidJson() throws IOException {
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{ invalid json structure");

        assertThatThrownBy(() -> new TelemetryFileConnector(invalid))
                .isInstanceOf(IOException.class);
    }

    @Test
    void shouldThrowExceptionForMissingMetadata() throws IOException {
        Path noMetadata = tempDir.resolve("no-metadata.json");
        Files.writeString(noMetadata, """
                {
                  "executions": []
                }
                """);

        assertThatThrownBy(() -> new TelemetryFileConnector(noMetadata))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing export_metadata section");
    }

    @Test
    void shouldThrowExceptionForMissingExecutionId() throws IOException {
        Path noId = tempDir.resolve("no-id.json");
        Files.writeString(noId, """
                {
                  "export_metadata": { "export_timestamp": "2025-06-01T10:30:00Z" },
                  "executions": [ { "sql_text": "SELECT 1", "duration_ms": 5 } ]
                }
                """);

        assertThatThrownBy(() -> new TelemetryFileConnector(noId))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("execution_id");
    }

    @Test
    void shouldHandleEmptyExport() throws IOException {
        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, """
                {
                  "export_metadata": { "export_timestamp": "2025-06-01T10:30:00Z" },
                  "executions": []
                }
                """);

        TelemetryFileConnector emptyConnector = new TelemetryFileConnector(empty);

        assertThat(emptyConnector.getExecutions()).isEmpty();
        assertThat(emptyConnector.getDatasets()).isEmpty();
        assertThat(emptyConnector.getExportMetadata().engine()).isEqualTo("unknown");
    }
}
