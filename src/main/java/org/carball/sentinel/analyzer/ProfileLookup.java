package org.carball.sentinel.analyzer;

import org.carball.sentinel.exception.ProfileLookupException;
import org.carball.sentinel.model.execution.ExecutionProfile;
import org.carball.sentinel.model.execution.ExecutionRecord;

import java.util.Optional;

/**
 * Source of execution profiles. An empty result means the execution has no profile; an exception
 * means the lookup itself failed.
 */
@FunctionalInterface
public interface ProfileLookup {

    Optional<ExecutionProfile> findProfile(ExecutionRecord record) throws ProfileLookupException;
}
