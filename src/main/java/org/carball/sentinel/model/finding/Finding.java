package org.carball.sentinel.model.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One detected issue. {@code subject} is the execution id for execution-level findings and the
 * dataset path for dataset-level findings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Finding {
    private IssueType issueType;
    private Severity severity;
    private String subject;
    private String title;
    private String description;

    @Builder.Default
    private Map<String, Object> evidence = new LinkedHashMap<>();

    private Double estimatedImprovementPct;

    public boolean hasEstimatedImprovement() {
        return estimatedImprovementPct != null;
    }
}
