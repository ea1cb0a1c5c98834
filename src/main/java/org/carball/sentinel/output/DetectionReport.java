package org.carball.sentinel.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.sentinel.analyzer.BatchDetectionResult;
import org.carball.sentinel.exception.SentinelException;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.Severity;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class DetectionReport {

    private static final String VERSION = "1.0.0";

    private final BatchDetectionResult result;
    private final List<Finding> datasetFindings;
    private final List<Baseline> baselines;
    private final Instant timestamp;
    private final ObjectMapper objectMapper;

    public DetectionReport(BatchDetectionResult result, List<Finding> datasetFindings, Collection<Baseline> baselines) {
        this(result, datasetFindings, baselines, Clock.systemUTC());
    }

    public DetectionReport(BatchDetectionResult result, List<Finding> datasetFindings,
                           Collection<Baseline> baselines, Clock clock) {
        this.result = result;
        this.datasetFindings = datasetFindings != null ? List.copyOf(datasetFindings) : List.of();
        this.baselines = baselines != null
                ? baselines.stream()
                    .sorted(Comparator.comparing(Baseline::p95DurationMs).reversed())
                    .collect(Collectors.toList())
                : List.of();
        this.timestamp = clock.instant();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new SentinelException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Query Performance Findings Report\n\n");
        md.append("**Generated:** ").append(DateTimeFormatter.ISO_INSTANT.format(timestamp)).append("  \n");
        md.append("**Sentinel Version:** ").append(VERSION).append("  \n\n");

        if (!result.completed()) {
            md.append("> ⚠️ Detection did not finish before the deadline. ")
                    .append(result.skipped()).append(" executions were not analyzed.\n\n");
        }

        // Overview
        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Executions Analyzed | ").append(result.analyzedCount()).append(" |\n");
        md.append("| Failed Profile Lookups | ").append(result.failedLookupCount()).append(" |\n");
        md.append("| Skipped | ").append(result.skipped()).append(" |\n");
        md.append("| Execution Findings | ").append(result.totalFindings()).append(" |\n");
        md.append("| Dataset Findings | ").append(datasetFindings.size()).append(" |\n");
        md.append("| Baselines | ").append(baselines.size()).append(" |\n\n");

        // Severity breakdown
        md.append("### Findings by Severity\n\n");
        md.append("| Severity | Count |\n");
        md.append("|----------|-------|\n");
        severityCounts().forEach((severity, count) ->
                md.append("| ").append(severityIcon(severity)).append(" **").append(severity).append("** | ")
                        .append(count).append(" |\n"));
        md.append("\n");

        // Execution findings
        md.append("## Execution Findings\n\n");
        boolean anyFindings = false;
        for (Map.Entry<String, List<Finding>> entry : result.findingsByExecutionId().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            anyFindings = true;
            md.append("### Execution `").append(entry.getKey()).append("`\n\n");
            entry.getValue().forEach(finding -> appendFinding(md, finding));
        }
        if (!anyFindings) {
            md.append("**No anti-patterns were detected in the analyzed executions.**\n\n");
        }

        // Dataset findings
        if (!datasetFindings.isEmpty()) {
            md.append("## Dataset Findings\n\n");
            datasetFindings.forEach(finding -> appendFinding(md, finding));
        }

        // Baselines
        if (!baselines.isEmpty()) {
            md.append("## Baselines\n\n");
            md.append("| Signature | Samples | p50 (ms) | p95 (ms) | p99 (ms) |\n");
            md.append("|-----------|---------|----------|----------|----------|\n");
            baselines.forEach(baseline -> md.append("| `").append(baseline.signature()).append("` | ")
                    .append(baseline.sampleCount()).append(" | ")
                    .append(format(baseline.p50DurationMs())).append(" | ")
                    .append(format(baseline.p95DurationMs())).append(" | ")
                    .append(format(baseline.p99DurationMs())).append(" |\n"));
            md.append("\n");
        }

        if (!result.failedLookups().isEmpty()) {
            md.append("## Failed Profile Lookups\n\n");
            result.failedLookups().forEach(id -> md.append("- `").append(id).append("`\n"));
            md.append("\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by Query Sentinel*\n");

        return md.toString();
    }

    private void appendFinding(StringBuilder md, Finding finding) {
        md.append("#### ").append(severityIcon(finding.getSeverity())).append(" ")
                .append(finding.getTitle()).append("\n\n");
        md.append("- **Type:** ").append(finding.getIssueType().getCode()).append("\n");
        md.append("- **Severity:** ").append(finding.getSeverity()).append("\n");
        md.append("- **Subject:** `").append(finding.getSubject()).append("`\n");
        if (finding.hasEstimatedImprovement()) {
            md.append("- **Estimated Improvement:** ").append(format(finding.getEstimatedImprovementPct()))
                    .append("%\n");
        }
        md.append("- **Details:** ").append(finding.getDescription()).append("\n");
        if (!finding.getEvidence().isEmpty()) {
            md.append("- **Evidence:**\n");
            finding.getEvidence().forEach((key, value) ->
                    md.append("  - ").append(key).append(": `").append(value).append("`\n"));
        }
        md.append("\n");
    }

    private Map<Severity, Long> severityCounts() {
        Map<Severity, Long> counts = new LinkedHashMap<>();
        for (Severity severity : List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW)) {
            counts.put(severity, 0L);
        }
        allFindings().forEach(finding -> counts.merge(finding.getSeverity(), 1L, Long::sum));
        return counts;
    }

    private List<Finding> allFindings() {
        List<Finding> all = new ArrayList<>();
        result.findingsByExecutionId().values().forEach(all::addAll);
        all.addAll(datasetFindings);
        return all;
    }

    private static String severityIcon(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return "🔴";
            case HIGH:
                return "🟠";
            case MEDIUM:
                return "🟡";
            default:
                return "🟢";
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();

        report.setReportMetadata(new ReportMetadata(
                timestamp,
                VERSION,
                result.analyzedCount(),
                result.failedLookupCount(),
                result.skipped(),
                result.completed(),
                result.totalFindings() + datasetFindings.size()));

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        severityCounts().forEach((severity, count) -> bySeverity.put(severity.name(), count));
        report.setFindingsBySeverity(bySeverity);

        List<ExecutionFindings> executions = result.findingsByExecutionId().entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .map(entry -> {
                    ExecutionFindings ef = new ExecutionFindings();
                    ef.setExecutionId(entry.getKey());
                    ef.setFindings(entry.getValue());
                    return ef;
                })
                .collect(Collectors.toList());
        report.setExecutions(executions);
        report.setDatasetFindings(datasetFindings);
        report.setBaselines(baselines);
        report.setFailedLookups(result.failedLookups());

        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata reportMetadata;
        private Map<String, Long> findingsBySeverity;
        private List<ExecutionFindings> executions;
        private List<Finding> datasetFindings;
        private List<Baseline> baselines;
        private List<String> failedLookups;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private Instant timestamp;
        private String sentinelVersion;
        private int executionsAnalyzed;
        private int failedLookups;
        private int skipped;
        private boolean completed;
        private int totalFindings;
    }

    @lombok.Data
    private static class ExecutionFindings {
        private String executionId;
        private List<Finding> findings;
    }
}
