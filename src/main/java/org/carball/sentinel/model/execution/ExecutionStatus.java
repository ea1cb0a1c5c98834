package org.carball.sentinel.model.execution;

/**
 * Terminal (or last observed) state of a query execution as reported by the engine.
 */
public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    CANCELED,
    RUNNING,
    UNKNOWN;

    public static ExecutionStatus fromEngineState(String state) {
        if (state == null || state.isBlank()) {
            return UNKNOWN;
        }
        switch (state.trim().toUpperCase()) {
            case "COMPLETED":
            case "SUCCEEDED":
            case "FINISHED":
                return COMPLETED;
            case "FAILED":
                return FAILED;
            case "CANCELED":
            case "CANCELLED":
                return CANCELED;
            case "RUNNING":
            case "ENQUEUED":
            case "STARTING":
                return RUNNING;
            default:
                return UNKNOWN;
        }
    }
}
