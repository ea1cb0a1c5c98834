package org.carball.sentinel.model.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resource telemetry for a single execution. Every numeric field is nullable: null means the engine
 * did not report it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionProfile {
    private String executionId;
    private Long rowsScanned;
    private Long rowsReturned;
    private Long bytesScanned;
    private Integer partitionsScanned;
    private Integer partitionsTotal;
    private Long memoryAllocatedBytes;
    private Long peakMemoryBytes;
    private Long cpuTimeMs;
    private boolean accelerationUsed;

    @Builder.Default
    private List<String> accelerationIds = new ArrayList<>();

    @Builder.Default
    private List<String> datasetPaths = new ArrayList<>();

    @Builder.Default
    private List<OperatorNode> operators = new ArrayList<>();

    public List<OperatorNode> operatorsOfType(OperatorType type) {
        return operators.stream()
                .filter(op -> op.type() == type)
                .collect(Collectors.toList());
    }
}
