package org.carball.sentinel.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sentinel.analyzer.BatchDetectionResult;
import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionReportTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private Clock clock;
    private Finding joinFinding;
    private Finding projectionFinding;
    private Finding smallFileFinding;
    private Baseline baseline;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("operator_id", "01-02");
        evidence.put("fan_out_ratio", 11.0);
        joinFinding = Finding.builder()
                .issueType(IssueType.JOIN_FAN_OUT)
                .severity(Severity.HIGH)
                .subject("exec-1")
                .title(IssueType.JOIN_FAN_OUT.getDefaultTitle())
                .description("Join 01-02 turned 1,000 input rows into 11,000 output rows (11.0x).")
                .evidence(evidence)
                .estimatedImprovementPct(9.09)
                .build();
        projectionFinding = Finding.builder()
                .issueType(IssueType.UNBOUNDED_PROJECTION)
                .severity(Severity.LOW)
                .subject("exec-1")
                .title(IssueType.UNBOUNDED_PROJECTION.getDefaultTitle())
                .description("Query selects every column (*).")
                .build();
        smallFileFinding = Finding.builder()
                .issueType(IssueType.SMALL_FILES)
                .severity(Severity.MEDIUM)
                .subject("lake.sales.orders")
                .title(IssueType.SMALL_FILES.getDefaultTitle())
                .description("Dataset lake.sales.orders has 5,000 files averaging 10.0 MB.")
                .estimatedImprovementPct(25.0)
                .build();
        baseline = new Baseline("a1b2c3d4e5f60718", 30, 900, 1_300, 1_100, 1_100, 1_280.5, 1_295, 512.0, null, NOW, NOW);
    }

    @Test
    void shouldRenderJsonReport() throws Exception {
        // Given
        DetectionReport report = new DetectionReport(result(true), List.of(smallFileFinding), List.of(baseline), clock);

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        JsonNode metadata = json.get("reportMetadata");
        assertThat(metadata.get("timestamp").asText()).isEqualTo("2025-06-01T12:00:00Z");
        assertThat(metadata.get("executionsAnalyzed").asInt()).isEqualTo(2);
        assertThat(metadata.get("failedLookups").asInt()).isEqualTo(1);
        assertThat(metadata.get("totalFindings").asInt()).isEqualTo(3);
        assertThat(metadata.get("completed").asBoolean()).isTrue();

        assertThat(json.get("findingsBySeverity").get("HIGH").asInt()).isEqualTo(1);
        assertThat(json.get("findingsBySeverity").get("CRITICAL").asInt()).isZero();

        JsonNode executions = json.get("executions");
        assertThat(executions.size()).isEqualTo(1);
        assertThat(executions.get(0).get("executionId").asText()).isEqualTo("exec-1");
        JsonNode firstFinding = executions.get(0).get("findings").get(0);
        assertThat(firstFinding.get("issueType").asText()).isEqualTo("JOIN_FAN_OUT");
        assertThat(firstFinding.get("evidence").get("operator_id").asText()).isEqualTo("01-02");

        assertThat(json.get("datasetFindings").get(0).get("subject").asText()).isEqualTo("lake.sales.orders");
        assertThat(json.get("baselines").get(0).get("p95DurationMs").asDouble()).isEqualTo(1_280.5);
        assertThat(json.get("failedLookups").get(0).asText()).isEqualTo("exec-3");
    }

    @Test
    void shouldOmitAbsentEstimates() throws Exception {
        DetectionReport report = new DetectionReport(result(true), List.of(), List.of(), clock);

        JsonNode projection = new ObjectMapper().readTree(report.toJson())
                .get("executions").get(0).get("findings").get(1);

        assertThat(projection.get("issueType").asText()).isEqualTo("UNBOUNDED_PROJECTION");
        assertThat(projection.has("estimatedImprovementPct")).isFalse();
    }

    @Test
    void shouldRenderMarkdownReport() {
        // Given
        DetectionReport report = new DetectionReport(result(true), List.of(smallFileFinding), List.of(baseline), clock);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .startsWith("# Query Performance Findings Report")
                .contains("**Generated:** 2025-06-01T12:00:00Z")
                .contains("| Executions Analyzed | 2 |")
                .contains("### Execution `exec-1`")
                .contains("Join multiplies row counts")
                .contains("- **Estimated Improvement:** 9.09%")
                .contains("## Dataset Findings")
                .contains("| `a1b2c3d4e5f60718` | 30 |")
                .contains("## Failed Profile Lookups")
                .doesNotContain("did not finish");
        assertThat(markdown.indexOf("Join multiplies row counts"))
                .isLessThan(markdown.indexOf("Query selects all columns"));
    }

    @Test
    void shouldMentionIncompleteRunsAndEmptyResults() {
        BatchDetectionResult partial = new BatchDetectionResult(
                Map.of("exec-1", List.of()), List.of(), 4, false);

        String markdown = new DetectionReport(partial, List.of(), List.of(), clock).toMarkdown();

        assertThat(markdown)
                .contains("4 executions were not analyzed")
                .contains("No anti-patterns were detected")
                .doesNotContain("## Baselines");
    }

    private BatchDetectionResult result(boolean completed) {
        Map<String, List<Finding>> findings = new LinkedHashMap<>();
        findings.put("exec-1", List.of(joinFinding, projectionFinding));
        findings.put("exec-2", List.of());
        return new BatchDetectionResult(findings, List.of("exec-3"), 0, completed);
    }
}
