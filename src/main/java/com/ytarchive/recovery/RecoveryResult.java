package com.ytarchive.recovery;

import java.util.List;

/**
 * Typed result of {@link ErrorRecoveryManager#executeWithRetry}. Terminal failures are returned, not
 * thrown.
 *
 * @param <T> the operation's result type
 */
public record RecoveryResult<T>(
        RecoveryOutcome outcome,
        T value,
        Exception failure,
        RetryReason reason,
        String reportId,
        List<AttemptRecord> attempts) {

    public boolean isSuccess() {
        return outcome == RecoveryOutcome.SUCCEEDED;
    }

    public boolean isCancelled() {
        return outcome == RecoveryOutcome.CANCELLED;
    }

    /**
     * Failure that is known to be permanent, as opposed to one that ran out of attempts.
     */
    public boolean isPermanentlyUnavailable() {
        return outcome == RecoveryOutcome.NON_RETRYABLE && reason == RetryReason.RESOURCE_UNAVAILABLE;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public String failureMessage() {
        if (failure == null) {
            return null;
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
