package org.carball.sentinel.model.measurement;

public enum MeasuredMetric {
    DURATION,
    MEMORY,
    DATA_SCANNED,
    CPU_TIME
}
