package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.AttemptRecord;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.RetryDecision;
import com.ytarchive.recovery.RetryReason;
import com.ytarchive.recovery.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rules shared by every strategy: attempt budget, retryable reasons and retry-after hints.
 * Subclasses only supply the raw delay and, optionally, an extra veto.
 */
public abstract class AbstractRetryStrategy implements RetryStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractRetryStrategy.class);

    protected final RetryConfig config;

    protected AbstractRetryStrategy(RetryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public RetryConfig config() {
        return config;
    }

    @Override
    public final RetryDecision nextDecision(ErrorContext context) {
        try {
            if (context.attemptCount() >= config.maxAttempts()) {
                return RetryDecision.stop();
            }
            AttemptRecord last = context.lastAttempt();
            RetryReason reason = last == null || last.reason() == null ? RetryReason.UNKNOWN : last.reason();
            if (!config.isRetryable(reason)) {
                return RetryDecision.stop();
            }
            if (!allowsRetry(context)) {
                return RetryDecision.stop();
            }

            Duration delay = computeDelay(context);
            Duration retryAfter = last == null ? null : last.retryAfter();
            if (reason == RetryReason.QUOTA_EXCEEDED) {
                // Only worth waiting when the quota resets inside our budget.
                if (retryAfter == null || retryAfter.compareTo(config.maxDelay()) > 0) {
                    return RetryDecision.stop();
                }
                delay = max(delay, retryAfter);
            } else if (reason == RetryReason.RATE_LIMIT && retryAfter != null) {
                delay = min(max(delay, retryAfter), config.maxDelay());
            }
            return RetryDecision.retryAfter(delay);
        } catch (RuntimeException unexpected) {
            log.warn("{} strategy failed to decide for {}, not retrying", name(), context, unexpected);
            return RetryDecision.stop();
        }
    }

    /**
     * Raw delay before the next attempt, jitter included.
     */
    protected abstract Duration computeDelay(ErrorContext context);

    /**
     * Extra veto on top of the shared rules.
     */
    protected boolean allowsRetry(ErrorContext context) {
        return true;
    }

    /**
     * {@code base * factor^(failures-1)}, capped at the configured maximum.
     */
    protected Duration exponentialDelay(int failedAttempts) {
        double multiplier = Math.pow(config.backoffFactor(), Math.max(0, failedAttempts - 1));
        double millis = config.baseDelay().toMillis() * multiplier;
        double cap = config.maxDelay().toMillis();
        return Duration.ofMillis((long) Math.min(millis, cap));
    }

    /**
     * Applies symmetric jitter of {@code ±fraction}. Never returns a negative duration.
     */
    protected Duration jitter(Duration delay, double fraction) {
        if (fraction <= 0 || delay.isZero()) {
            return delay;
        }
        double offset = ThreadLocalRandom.current().nextDouble(-fraction, fraction);
        long millis = Math.round(delay.toMillis() * (1 + offset));
        return Duration.ofMillis(Math.max(0, millis));
    }

    protected static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    protected static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
