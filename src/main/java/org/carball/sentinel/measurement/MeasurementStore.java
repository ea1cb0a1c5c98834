package org.carball.sentinel.measurement;

import org.carball.sentinel.model.measurement.Measurement;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for measurements, one per recommendation id.
 */
public interface MeasurementStore {

    Optional<Measurement> find(String recommendationId);

    /**
     * Atomically stores the measurement unless one already exists for its recommendation id.
     *
     * @return true if stored, false if a measurement was already present
     */
    boolean insertIfAbsent(Measurement measurement);

    /**
     * Replaces an existing measurement. Throws {@link IllegalStateException} if none exists.
     */
    void replace(Measurement measurement);

    List<Measurement> findCompletedSince(Instant since);
}
