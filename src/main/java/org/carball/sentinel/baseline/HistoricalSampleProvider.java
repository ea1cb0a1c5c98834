package org.carball.sentinel.baseline;

import org.carball.sentinel.model.baseline.HistoricalSample;
import org.carball.sentinel.signature.Signature;

import java.util.List;

/**
 * Supplies historical executions of a signature. Only consulted while a baseline is refreshed.
 */
@FunctionalInterface
public interface HistoricalSampleProvider {

    List<HistoricalSample> samplesFor(Signature signature);
}
