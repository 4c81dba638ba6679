package io.chronr.query;

/**
 * RECEIVED -> VALIDATING -> (FAILED | SCHEDULED) -> RUNNING -> (FAILED | COMPLETED)
 */
public enum QueryState {
    RECEIVED,
    VALIDATING,
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isDone() {
        return this == COMPLETED || this == FAILED;
    }
}
