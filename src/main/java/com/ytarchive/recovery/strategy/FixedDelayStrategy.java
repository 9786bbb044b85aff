package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;

import java.time.Duration;

/**
 * Waits {@code baseDelay ± jitterFraction} between attempts.
 */
public class FixedDelayStrategy extends AbstractRetryStrategy {

    public FixedDelayStrategy(RetryConfig config) {
        super(config);
    }

    @Override
    public String name() {
        return "fixed-delay";
    }

    @Override
    protected Duration computeDelay(ErrorContext context) {
        return jitter(config.baseDelay(), config.jitterFraction());
    }
}
