package org.carball.sentinel.model.finding;

/**
 * Finding severity, declared in ascending order so that {@link #compareTo} ranks CRITICAL highest.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
