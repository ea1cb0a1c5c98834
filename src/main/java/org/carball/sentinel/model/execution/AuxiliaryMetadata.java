package org.carball.sentinel.model.execution;

import java.util.List;

/**
 * Externally supplied metadata some detectors need beyond the execution itself.
 */
public record AuxiliaryMetadata(
        List<DatasetStorageMetadata> datasets,
        List<AccelerationMetadata> accelerations
) {

    private static final AuxiliaryMetadata EMPTY = new AuxiliaryMetadata(List.of(), List.of());

    public AuxiliaryMetadata {
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
        accelerations = accelerations == null ? List.of() : List.copyOf(accelerations);
    }

    public static AuxiliaryMetadata empty() {
        return EMPTY;
    }
}
