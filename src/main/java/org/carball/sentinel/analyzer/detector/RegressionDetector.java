package org.carball.sentinel.analyzer.detector;

import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.baseline.BaselineStore;
import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;
import org.carball.sentinel.signature.Signature;
import org.carball.sentinel.signature.SignatureGenerator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags executions far slower than the p95 of their signature's baseline. Reads the baseline store
 * only; refreshing baselines is the {@link org.carball.sentinel.baseline.BaselineCalculator}'s job.
 */
@Slf4j
public class RegressionDetector implements IssueDetector {

    private final SignatureGenerator signatureGenerator;
    private final BaselineStore baselineStore;
    private final int minSamples;
    private final double multiplier;

    public RegressionDetector(SignatureGenerator signatureGenerator, BaselineStore baselineStore, ThresholdConfig thresholds) {
        this.signatureGenerator = signatureGenerator;
        this.baselineStore = baselineStore;
        this.minSamples = thresholds.getMinBaselineSamples();
        this.multiplier = thresholds.getRegressionMultiplier();
    }

    @Override
    public String getName() {
        return "regression";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (record.sqlText() == null || record.sqlText().isBlank()) {
            return List.of();
        }
        Signature signature = signatureGenerator.computeSignature(record.sqlText());
        Optional<Baseline> found = baselineStore.get(signature);
        if (found.isEmpty()) {
            log.debug("No baseline for signature {} (execution {})", signature, record.executionId());
            return List.of();
        }
        Baseline baseline = found.get();
        if (baseline.sampleCount() < minSamples) {
            return List.of();
        }

        double p95 = baseline.p95DurationMs();
        double thresholdMs = p95 * multiplier;
        if (record.durationMs() <= thresholdMs) {
            return List.of();
        }

        // no relative degradation against a zero p95
        Double degradationPct = p95 > 0 ? (record.durationMs() - p95) / p95 * 100.0 : null;
        double recoverablePct = (record.durationMs() - p95) / record.durationMs() * 100.0;

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("signature", signature.value());
        evidence.put("duration_ms", record.durationMs());
        evidence.put("baseline_p50_ms", Percentages.round(baseline.p50DurationMs()));
        evidence.put("baseline_p95_ms", Percentages.round(p95));
        evidence.put("threshold_ms", Percentages.round(thresholdMs));
        evidence.put("sample_count", baseline.sampleCount());
        if (degradationPct != null) {
            evidence.put("degradation_pct", Percentages.round(degradationPct));
        }

        return List.of(Finding.builder()
                .issueType(IssueType.PERFORMANCE_REGRESSION)
                .severity(Severity.CRITICAL)
                .subject(record.executionId())
                .title(IssueType.PERFORMANCE_REGRESSION.getDefaultTitle())
                .description(degradationPct != null
                        ? String.format("Query took %,d ms, %.0f%% above its baseline p95 of %.0f ms over %d runs.",
                                record.durationMs(), degradationPct, p95, baseline.sampleCount())
                        : String.format("Query took %,d ms against a baseline p95 of 0 ms over %d runs.",
                                record.durationMs(), baseline.sampleCount()))
                .evidence(evidence)
                .estimatedImprovementPct(Percentages.round(recoverablePct))
                .build());
    }
}
