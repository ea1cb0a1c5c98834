package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AccelerationMetadata;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags slow queries that were not answered by an acceleration structure.
 *
 * <p>When no structure covers the datasets the query read, the acceleration is missing. When
 * structures exist but the best of them is rarely hit, it is underutilized. A structure with a
 * healthy hit ratio that simply missed this one execution is not reported.
 */
public class AccelerationOpportunityDetector implements IssueDetector {

    private final long durationThresholdMs;
    private final double hitRatioFloor;
    private final double missingImprovementPct;
    private final double underutilizedImprovementPct;

    public AccelerationOpportunityDetector(ThresholdConfig thresholds) {
        this.durationThresholdMs = thresholds.getAccelerationDurationThresholdMs();
        this.hitRatioFloor = thresholds.getAccelerationHitRatioFloor();
        this.missingImprovementPct = thresholds.getAccelerationMissingImprovementPct();
        this.underutilizedImprovementPct = thresholds.getAccelerationUnderutilizedImprovementPct();
    }

    @Override
    public String getName() {
        return "acceleration-opportunity";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (profile == null || profile.isAccelerationUsed() || record.durationMs() <= durationThresholdMs) {
            return List.of();
        }

        List<AccelerationMetadata> candidates = matchingStructures(profile, auxiliary);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("duration_ms", record.durationMs());
        evidence.put("duration_threshold_ms", durationThresholdMs);
        evidence.put("acceleration_used", false);

        if (candidates.isEmpty()) {
            evidence.put("datasets", datasetPaths(profile));
            return List.of(Finding.builder()
                    .issueType(IssueType.ACCELERATION_MISSING)
                    .severity(Severity.MEDIUM)
                    .subject(record.executionId())
                    .title(IssueType.ACCELERATION_MISSING.getDefaultTitle())
                    .description(String.format(
                            "Query ran for %,d ms without acceleration and no acceleration structure covers its datasets.",
                            record.durationMs()))
                    .evidence(evidence)
                    .estimatedImprovementPct(missingImprovementPct)
                    .build());
        }

        AccelerationMetadata structure = candidates.stream()
                .max(Comparator.comparingDouble(AccelerationMetadata::hitRatio))
                .orElseThrow();
        if (structure.hitRatio() >= hitRatioFloor) {
            return List.of();
        }

        evidence.put("acceleration_id", structure.accelerationId());
        evidence.put("acceleration_name", structure.name());
        evidence.put("hit_ratio", Percentages.round(structure.hitRatio()));
        evidence.put("hit_ratio_floor", hitRatioFloor);
        evidence.put("candidate_count", candidates.size());

        return List.of(Finding.builder()
                .issueType(IssueType.ACCELERATION_UNDERUTILIZED)
                .severity(Severity.MEDIUM)
                .subject(record.executionId())
                .title(IssueType.ACCELERATION_UNDERUTILIZED.getDefaultTitle())
                .description(String.format(
                        "Acceleration structure '%s' exists but answers only %.0f%% of matching queries; this %,d ms query did not use it.",
                        structure.name(), structure.hitRatio() * 100.0, record.durationMs()))
                .evidence(evidence)
                .estimatedImprovementPct(underutilizedImprovementPct)
                .build());
    }

    private static List<AccelerationMetadata> matchingStructures(ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (auxiliary == null) {
            return List.of();
        }
        Set<String> datasets = new HashSet<>(datasetPaths(profile));
        return auxiliary.accelerations().stream()
                .filter(a -> datasets.isEmpty() || datasets.contains(a.datasetPath()))
                .collect(Collectors.toList());
    }

    private static List<String> datasetPaths(ExecutionProfile profile) {
        return profile.getDatasetPaths() != null ? profile.getDatasetPaths() : List.of();
    }
}
