package com.ytarchive.recovery;

import java.time.Duration;

/**
 * Maps a raised failure to a {@link RetryReason}.
 */
@FunctionalInterface
public interface ErrorClassifier {

    RetryReason classify(Exception exception);

    /**
     * Retry-after hint carried by the failure, if any. Honoured for RATE_LIMIT and required for
     * QUOTA_EXCEEDED retries.
     */
    default Duration retryAfter(Exception exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof CollaboratorException collaboratorException
                    && collaboratorException.getRetryAfter() != null) {
                return collaboratorException.getRetryAfter();
            }
            current = current.getCause();
        }
        return null;
    }
}
