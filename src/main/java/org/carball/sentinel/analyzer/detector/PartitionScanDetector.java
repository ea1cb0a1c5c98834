package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags queries that read most partitions of a partitioned dataset, i.e. pruning did not apply.
 */
public class PartitionScanDetector implements IssueDetector {

    private final int partitionFloor;
    private final double ratioCeiling;

    public PartitionScanDetector(ThresholdConfig thresholds) {
        this.partitionFloor = thresholds.getPartitionFloor();
        this.ratioCeiling = thresholds.getPartitionScanRatioCeiling();
    }

    @Override
    public String getName() {
        return "partition-scan";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (profile == null || profile.getPartitionsTotal() == null || profile.getPartitionsScanned() == null) {
            return List.of();
        }
        int total = profile.getPartitionsTotal();
        int scanned = profile.getPartitionsScanned();
        if (total <= partitionFloor) {
            // not partitioned in any meaningful way
            return List.of();
        }

        double ratio = (double) scanned / total;
        if (ratio <= ratioCeiling) {
            return List.of();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("partitions_scanned", scanned);
        evidence.put("partitions_total", total);
        evidence.put("scan_ratio", Percentages.round(ratio));
        evidence.put("ratio_ceiling", ratioCeiling);

        double estimated = Percentages.clamp((ratio - ratioCeiling) / ratio * 100.0);

        return List.of(Finding.builder()
                .issueType(IssueType.PARTITION_SCAN)
                .severity(Severity.HIGH)
                .subject(record.executionId())
                .title(IssueType.PARTITION_SCAN.getDefaultTitle())
                .description(String.format(
                        "Query scanned %d of %d partitions (%.0f%%). A filter on the partition columns would let the engine prune most of them.",
                        scanned, total, ratio * 100.0))
                .evidence(evidence)
                .estimatedImprovementPct(Percentages.round(estimated))
                .build());
    }
}
