package org.carball.sentinel.analyzer.detector;

import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;
import org.carball.sentinel.model.finding.Finding;

import java.util.List;

/**
 * A single anti-pattern check over one execution.
 *
 * <p>Implementations are deterministic and side-effect free. Missing optional input (no profile,
 * unknown counters, no auxiliary metadata) yields an empty list, never an exception.
 */
public interface IssueDetector {

    String getName();

    List<Finding> evaluate(ExecutionRecord record, ExecutionProfile profile, AuxiliaryMetadata auxiliary);
}
