package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.baseline.InMemoryBaselineStore;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.execution.ExecutionStatus;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;
import org.carball.sentinel.signature.Signature;
import org.carball.sentinel.signature.SignatureGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegressionDetectorTest {

    private static final String SQL = "SELECT region, SUM(amount) FROM sales.orders WHERE day = '2025-06-01' GROUP BY region";

    private SignatureGenerator signatureGenerator;
    private InMemoryBaselineStore store;
    private RegressionDetector detector;

    @BeforeEach
    void setUp() {
        signatureGenerator = new SignatureGenerator();
        store = new InMemoryBaselineStore();
        detector = new RegressionDetector(signatureGenerator, store, ThresholdConfig.createDefaults());
    }

    @Test
    void shouldFlagExecutionAboveBaselineThreshold() {
        // Given
        storeBaseline(25, 1_000.0);

        // When
        List<Finding> findings = detector.evaluate(record(1_600), null, AuxiliaryMetadata.empty());

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getIssueType()).isEqualTo(IssueType.PERFORMANCE_REGRESSION);
        assertThat(finding.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.getEstimatedImprovementPct()).isEqualTo(37.5);
        assertThat(finding.getEvidence())
                .containsEntry("baseline_p95_ms", 1_000.0)
                .containsEntry("threshold_ms", 1_500.0)
                .containsEntry("degradation_pct", 60.0)
                .containsEntry("sample_count", 25);
    }

    @Test
    void shouldMatchExecutionsDifferingOnlyInLiterals() {
        storeBaseline(25, 1_000.0);
        ExecutionRecord otherDay = new ExecutionRecord("exec-2",
                "SELECT region, SUM(amount) FROM sales.orders WHERE day = '2025-06-02' GROUP BY region",
                "analyst", "default", null, null, 5_000, ExecutionStatus.COMPLETED);

        assertThat(detector.evaluate(otherDay, null, AuxiliaryMetadata.empty())).hasSize(1);
    }

    @Test
    void shouldNotFlagWithinThreshold() {
        storeBaseline(25, 1_000.0);

        assertThat(detector.evaluate(record(1_400), null, AuxiliaryMetadata.empty())).isEmpty();
        assertThat(detector.evaluate(record(1_500), null, AuxiliaryMetadata.empty())).isEmpty();
    }

    @Test
    void shouldNotTrustUndersampledBaseline() {
        storeBaseline(10, 1_000.0);

        assertThat(detector.evaluate(record(60_000), null, AuxiliaryMetadata.empty())).isEmpty();
    }

    @Test
    void shouldFlagAgainstZeroP95WithoutDegradationPercentage() {
        // Given a well-sampled baseline of instant runs
        Signature signature = signatureGenerator.computeSignature(SQL);
        Instant now = Instant.parse("2025-06-01T00:00:00Z");
        store.put(signature, new Baseline(signature.value(), 50, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                null, null, now, now));

        // When
        List<Finding> findings = detector.evaluate(record(60_000), null, AuxiliaryMetadata.empty());

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.getEstimatedImprovementPct()).isEqualTo(100.0);
        assertThat(finding.getEvidence())
                .containsEntry("baseline_p95_ms", 0.0)
                .containsEntry("threshold_ms", 0.0)
                .doesNotContainKey("degradation_pct");
        assertThat(detector.evaluate(record(0), null, AuxiliaryMetadata.empty())).isEmpty();
    }

    @Test
    void shouldAbstainWithoutBaseline() {
        assertThat(detector.evaluate(record(60_000), null, AuxiliaryMetadata.empty())).isEmpty();
        assertThat(store.size()).isZero();
    }

    private void storeBaseline(int samples, double p95) {
        Signature signature = signatureGenerator.computeSignature(SQL);
        Instant now = Instant.parse("2025-06-01T00:00:00Z");
        store.put(signature, new Baseline(signature.value(), samples, 100.0, p95 * 2, p95 / 2, p95 / 2, p95,
                p95 * 1.5, null, null, now, now));
    }

    private static ExecutionRecord record(long durationMs) {
        return new ExecutionRecord("exec-1", SQL, "analyst", "default", null, null, durationMs,
                ExecutionStatus.COMPLETED);
    }
}
