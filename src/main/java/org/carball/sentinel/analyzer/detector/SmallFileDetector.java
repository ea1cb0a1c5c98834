package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.DatasetStorageMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags datasets split into many undersized files. Works on storage metadata, so it can also be
 * run as a dataset audit through {@link #evaluateDataset}.
 */
public class SmallFileDetector implements IssueDetector {

    private final long fileCountThreshold;
    private final double avgSizeThresholdMb;
    private final double estimatedImprovementPct;

    public SmallFileDetector(ThresholdConfig thresholds) {
        this.fileCountThreshold = thresholds.getSmallFileCountThreshold();
        this.avgSizeThresholdMb = thresholds.getSmallFileAvgSizeMb();
        this.estimatedImprovementPct = thresholds.getSmallFileImprovementPct();
    }

    @Override
    public String getName() {
        return "small-file";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (auxiliary == null || auxiliary.datasets().isEmpty()) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (DatasetStorageMetadata dataset : auxiliary.datasets()) {
            evaluateDataset(dataset).ifPresent(finding -> {
                finding.getEvidence().put("execution_id", record.executionId());
                findings.add(finding);
            });
        }
        return findings;
    }

    public Optional<Finding> evaluateDataset(DatasetStorageMetadata dataset) {
        if (dataset == null || dataset.fileCount() <= fileCountThreshold) {
            return Optional.empty();
        }
        double avgSizeMb = dataset.averageFileSizeMb();
        if (avgSizeMb >= avgSizeThresholdMb) {
            return Optional.empty();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("dataset_path", dataset.datasetPath());
        evidence.put("file_count", dataset.fileCount());
        evidence.put("avg_file_size_mb", Percentages.round(avgSizeMb));
        evidence.put("file_count_threshold", fileCountThreshold);
        evidence.put("avg_size_threshold_mb", avgSizeThresholdMb);

        return Optional.of(Finding.builder()
                .issueType(IssueType.SMALL_FILES)
                .severity(Severity.MEDIUM)
                .subject(dataset.datasetPath())
                .title(IssueType.SMALL_FILES.getDefaultTitle())
                .description(String.format(
                        "Dataset %s has %,d files averaging %.1f MB. Compacting into larger files cuts per-file open and metadata overhead.",
                        dataset.datasetPath(), dataset.fileCount(), avgSizeMb))
                .evidence(evidence)
                .estimatedImprovementPct(estimatedImprovementPct)
                .build());
    }
}
