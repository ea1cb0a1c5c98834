package org.carball.sentinel.analyzer;

import org.carball.sentinel.model.finding.Finding;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch run. {@code findingsByExecutionId} keeps input order and holds an entry, possibly
 * empty, for every execution that was analyzed. Executions whose profile lookup failed are listed in
 * {@code failedLookups}; executions not reached before the deadline or cancellation are counted in
 * {@code skipped}. Repeated execution ids are analyzed once.
 */
public record BatchDetectionResult(
        Map<String, List<Finding>> findingsByExecutionId,
        List<String> failedLookups,
        int skipped,
        boolean completed
) {

    public int analyzedCount() {
        return findingsByExecutionId.size();
    }

    public int failedLookupCount() {
        return failedLookups.size();
    }

    public int totalFindings() {
        return findingsByExecutionId.values().stream()
                .mapToInt(List::size)
                .sum();
    }
}
