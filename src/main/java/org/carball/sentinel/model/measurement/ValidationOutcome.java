package org.carball.sentinel.model.measurement;

public enum ValidationOutcome {
    /** Actual duration improvement reached or beat the estimate. */
    EXCEEDED,
    /** Below the estimate but inside the tolerance band. */
    MET,
    UNDERPERFORMED,
    /** The before execution had no usable duration to compare against. */
    INCONCLUSIVE
}
