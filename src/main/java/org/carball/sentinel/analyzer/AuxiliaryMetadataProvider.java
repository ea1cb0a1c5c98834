package org.carball.sentinel.analyzer;

import org.carball.sentinel.model.execution.AuxiliaryMetadata;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;

/**
 * Supplies the dataset storage and acceleration metadata relevant to one execution.
 */
@FunctionalInterface
public interface AuxiliaryMetadataProvider {

    AuxiliaryMetadataProvider NONE = (record, profile) -> AuxiliaryMetadata.empty();

    AuxiliaryMetadata metadataFor(ExecutionRecord record, ExecutionProfile profile);
}
