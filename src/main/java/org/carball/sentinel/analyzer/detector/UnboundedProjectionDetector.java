package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.config.ThresholdConfig;
import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;
import org.carball.sentinel.model.finding.IssueType;
import org.carball.sentinel.model.finding.Severity;
import org.carball.sentinel.parser.StatementClassifier;
import org.carball.sentinel.signature.SignatureGenerator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical check for wildcard column selection ({@code SELECT *}, {@code SELECT t.*}, {@code , *}).
 * {@code COUNT(*)} and wildcards inside string literals do not count.
 */
public class UnboundedProjectionDetector implements IssueDetector {

    private static final Pattern WILDCARD_PROJECTION = Pattern.compile(
            "(?:\\bSELECT\\s+(?:DISTINCT\\s+|ALL\\s+)?|,\\s*)((?:(?:\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_]*)\\.)*\\*)(?=\\s*(?:,|\\bFROM\\b|$))",
            Pattern.CASE_INSENSITIVE);

    private final double estimatedImprovementPct;

    public UnboundedProjectionDetector(ThresholdConfig thresholds) {
        this.estimatedImprovementPct = thresholds.getUnboundedProjectionImprovementPct();
    }

    @Override
    public String getName() {
        return "unbounded-projection";
    }

    @Override
    public List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary) {
        String sql = record.sqlText();
        if (sql == null || sql.isBlank()) {
            return List.of();
        }

        Matcher matcher = WILDCARD_PROJECTION.matcher(SignatureGenerator.stripStringLiterals(sql));
        if (!matcher.find()) {
            return List.of();
        }
        if (StatementClassifier.isSchemaDefinition(sql)) {
            return List.of();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("pattern", matcher.group(1));
        if (profile != null && profile.getBytesScanned() != null) {
            evidence.put("bytes_scanned", profile.getBytesScanned());
        }

        return List.of(Finding.builder()
                .issueType(IssueType.UNBOUNDED_PROJECTION)
                .severity(Severity.LOW)
                .subject(record.executionId())
                .title(IssueType.UNBOUNDED_PROJECTION.getDefaultTitle())
                .description("Query selects every column (" + matcher.group(1)
                        + "). Listing only the needed columns reduces data read from columnar storage.")
                .evidence(evidence)
                .estimatedImprovementPct(estimatedImprovementPct)
                .build());
    }
}
