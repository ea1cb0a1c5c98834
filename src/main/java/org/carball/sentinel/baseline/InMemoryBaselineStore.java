package org.carball.sentinel.baseline;

import org.carball.sentinel.model.baseline.Baseline;
import org.carball.sentinel.signature.Signature;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBaselineStore implements BaselineStore {

    private final Map<Signature, Baseline> baselines = new ConcurrentHashMap<>();

    @Override
    public Optional<Baseline> get(Signature signature) {
        return Optional.ofNullable(baselines.get(signature));
    }

    @Override
    public void put(Signature signature, Baseline baseline) {
        if (!signature.value().equals(baseline.signature())) {
            throw new IllegalArgumentException("Baseline for " + baseline.signature()
                    + " cannot be stored under signature " + signature);
        }
        baselines.put(signature, baseline);
    }

    public int size() {
        return baselines.size();
    }
}
