package org.carball.sentinel.baseline;

import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.signature.Signature;

import java.util.Optional;

/**
 * Storage for baselines keyed by signature. Implementations replace baselines wholesale on
 * {@link #put} and must make a put visible to subsequent {@link #get} calls from other threads.
 */
public interface BaselineStore {

    Optional<Baseline> get(Signature signature);

    void put(Signature signature, Baseline baseline);
}
