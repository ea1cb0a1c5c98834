package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.execution.ExecutionStatus;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PartitionScanDetectorTest {

    private final PartitionScanDetector detector = new PartitionScanDetector(ThresholdConfig.createDefaults());

    @Test
    void shouldFlagFullPartitionScan() {
        // Given
        ExecutionProfile profile = partitions(365, 365);

        // When
        List<Finding> findings = detector.evaluate(record(), profile, AuxiliaryMetadata.empty());

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getIssueType()).isEqualTo(IssueType.PARTITION_SCAN);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getSubject()).isEqualTo("exec-1");
        assertThat(finding.getEstimatedImprovementPct()).isEqualTo(50.0);
        assertThat(finding.getEvidence())
                .containsEntry("partitions_scanned", 365)
                .containsEntry("partitions_total", 365)
                .containsEntry("scan_ratio", 1.0);
    }

    @Test
    void shouldNotFlagPrunedScan() {
        List<Finding> findings = detector.evaluate(record(), partitions(30, 365), AuxiliaryMetadata.empty());

        assertThat(findings).isEmpty();
    }

    @Test
    void shouldNotFlagRatioAtCeiling() {
        assertThat(detector.evaluate(record(), partitions(100, 200), AuxiliaryMetadata.empty())).isEmpty();
    }

    @Test
    void shouldIgnoreUnpartitionedDatasets() {
        assertThat(detector.evaluate(record(), partitions(1, 1), AuxiliaryMetadata.empty())).isEmpty();
    }

    @Test
    void shouldAbstainWhenCountsUnknown() {
        ExecutionProfile unknownScanned = ExecutionProfile.builder().partitionsTotal(365).build();

        assertThat(detector.evaluate(record(), unknownScanned, AuxiliaryMetadata.empty())).isEmpty();
        assertThat(detector.evaluate(record(), null, AuxiliaryMetadata.empty())).isEmpty();
    }

    private static ExecutionProfile partitions(int scanned, int total) {
        return ExecutionProfile.builder()
                .executionId("exec-1")
                .partitionsScanned(scanned)
                .partitionsTotal(total)
                .build();
    }

    private static ExecutionRecord record() {
        return new ExecutionRecord("exec-1", "SELECT SUM(amount) FROM sales.events", "analyst", "default",
                Instant.parse("2025-06-01T10:00:00Z"), Instant.parse("2025-06-01T10:00:42Z"), 42_000,
                ExecutionStatus.COMPLETED);
    }
}
