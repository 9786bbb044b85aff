package com.ytarchive.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of {@link RetryStrategy#nextDecision(ErrorContext)}.
 */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
    }

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
