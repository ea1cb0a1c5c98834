package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.execution.OperatorNode;
import org.carball.sentinel.model.execution.OperatorType;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags join operators whose output row count is a large multiple of their input.
 */
public class JoinFanOutDetector implements IssueDetector {

    private final double multiplier;

    public JoinFanOutDetector(ThresholdConfig thresholds) {
        this.multiplier = thresholds.getJoinFanOutMultiplier();
    }

    @Override
    public String getName() {
        return "join-fan-out";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        if (profile == null || profile.getOperators() == null) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        for (OperatorNode join : profile.operatorsOfType(OperatorType.JOIN)) {
            if (join.inputRows() == null || join.outputRows() == null || join.inputRows() <= 0) {
                continue;
            }
            double ratio = (double) join.outputRows() / join.inputRows();
            if (ratio <= multiplier) {
                continue;
            }

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("operator_id", join.operatorId());
            evidence.put("rows_in", join.inputRows());
            evidence.put("rows_out", join.outputRows());
            evidence.put("fan_out_ratio", Percentages.round(ratio));
            evidence.put("multiplier_threshold", multiplier);

            findings.add(Finding.builder()
                    .issueType(IssueType.JOIN_FAN_OUT)
                    .severity(Severity.HIGH)
                    .subject(record.executionId())
                    .title(IssueType.JOIN_FAN_OUT.getDefaultTitle())
                    .description(String.format(
                            "Join %s turned %,d input rows into %,d output rows (%.1fx). Check join keys for duplicates or a missing condition.",
                            join.operatorId(), join.inputRows(), join.outputRows(), ratio))
                    .evidence(evidence)
                    .estimatedImprovementPct(Percentages.round(Percentages.clamp((1.0 - multiplier / ratio) * 100.0)))
                    .build());
        }
        return findings;
    }
}
