package com.ytarchive.recovery;

import java.time.Duration;
import java.time.Instant;

/**
 * One invocation of a wrapped operation. Failed attempts carry the classification and, once the
 * strategy decided to retry, the backoff that followed them.
 */
public record AttemptRecord(
        int number,
        Instant startedAt,
        Duration duration,
        boolean succeeded,
        String exceptionType,
        String message,
        RetryReason reason,
        Duration retryAfter,
        Duration delayApplied) {

    static AttemptRecord success(int number, Instant startedAt, Duration duration) {
        return new AttemptRecord(number, startedAt, duration, true, null, null, null, null, Duration.ZERO);
    }

    static AttemptRecord failure(int number, Instant startedAt, Duration duration, Exception exception,
            RetryReason reason, Duration retryAfter) {
        return new AttemptRecord(number, startedAt, duration, false, exception.getClass().getName(),
                exception.getMessage(), reason, retryAfter, Duration.ZERO);
    }

    AttemptRecord withDelayApplied(Duration delay) {
        return new AttemptRecord(number, startedAt, duration, succeeded, exceptionType, message, reason, retryAfter,
                delay);
    }
}
