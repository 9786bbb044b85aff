package com.ytarchive.recovery;

import java.time.Duration;

/**
 * Observes backoff waits inside {@link ErrorRecoveryManager#executeWithRetry}.
 */
public interface RetryListener {

    RetryListener NONE = new RetryListener() {
    };

    /**
     * Called right before the manager starts waiting for {@code delay}.
     */
    default void onBackoffStarted(ErrorContext context, Duration delay) {
        // no-op
    }

    /**
     * Called when the wait ended, whether it elapsed or was cancelled.
     */
    default void onBackoffFinished(ErrorContext context) {
        // no-op
    }
}
