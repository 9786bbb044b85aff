package com.ytarchive.recovery;

/**
 * How a call to {@link ErrorRecoveryManager#executeWithRetry} ended. Lets callers tell "tried and
 * gave up" apart from "known permanently unavailable".
 */
public enum RecoveryOutcome {

    SUCCEEDED(RecoveryStatus.SUCCEEDED),

    /**
     * Retryable failures used up the attempt budget, or the strategy stopped early.
     */
    EXHAUSTED(RecoveryStatus.FAILED_RETRYABLE_EXHAUSTED),

    /**
     * The failure was classified as non-retryable.
     */
    NON_RETRYABLE(RecoveryStatus.FAILED_NONRETRYABLE),

    /**
     * The collaborator's error handler took ownership of the failure.
     */
    HANDLED(RecoveryStatus.FAILED_NONRETRYABLE),

    /**
     * A circuit breaker refused the attempt without invoking the operation.
     */
    CIRCUIT_OPEN(RecoveryStatus.FAILED_RETRYABLE_EXHAUSTED),

    CANCELLED(RecoveryStatus.CANCELLED);

    private final RecoveryStatus status;

    RecoveryOutcome(RecoveryStatus status) {
        this.status = status;
    }

    public RecoveryStatus status() {
        return status;
    }
}
