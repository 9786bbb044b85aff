package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;

import java.time.Duration;

/**
 * {@code min(baseDelay * backoffFactor^(attempts-1), maxDelay)} followed by symmetric jitter, so
 * that concurrent retries against the same collaborator spread out.
 */
public class ExponentialBackoffStrategy extends AbstractRetryStrategy {

    public ExponentialBackoffStrategy(RetryConfig config) {
        super(config);
    }

    @Override
    public String name() {
        return "exponential-backoff";
    }

    @Override
    protected Duration computeDelay(ErrorContext context) {
        return jitter(exponentialDelay(context.failedAttemptCount()), config.jitterFraction());
    }
}
