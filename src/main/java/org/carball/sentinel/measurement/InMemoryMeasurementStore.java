package org.carball.sentinel.measurement;

import org.carball.sentinel.model.measurement.Measurement;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

public class InMemoryMeasurementStore implements MeasurementStore {

    private final ConcurrentMap<String, Measurement> measurements = new ConcurrentHashMap<>();

    @Override
    public Optional<Measurement> find(String recommendationId) {
        return Optional.ofNullable(measurements.get(recommendationId));
    }

    @Override
    public boolean insertIfAbsent(Measurement measurement) {
        return measurements.putIfAbsent(measurement.getRecommendationId(), measurement) == null;
    }

    @Override
    public void replace(Measurement measurement) {
        if (measurements.replace(measurement.getRecommendationId(), measurement) == null) {
            throw new IllegalStateException("No measurement to replace for recommendation "
                    + measurement.getRecommendationId());
        }
    }

    @Override
    public List<Measurement> findCompletedSince(Instant since) {
        return measurements.values().stream()
                .filter(Measurement::isCompleted)
                .filter(m -> m.getMeasuredAt() != null && !m.getMeasuredAt().isBefore(since))
                .sorted(Comparator.comparing(Measurement::getMeasuredAt))
                .collect(Collectors.toList());
    }
}
