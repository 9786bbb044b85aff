package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.AttemptRecord;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Scales backoff with the recent success rate of the resource: a failing collaborator is retried
 * more slowly, a healthy one faster. Gives up early once the success rate drops below
 * {@link RetryConfig#successFloor()} over at least {@link RetryConfig#minSamples()} samples.
 */
public class AdaptiveStrategy extends AbstractRetryStrategy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveStrategy.class);

    static final double MAX_MULTIPLIER = 2.0;
    static final double MIN_MULTIPLIER = 0.5;

    private final AdaptiveMetricsRegistry registry;

    public AdaptiveStrategy(RetryConfig config, AdaptiveMetricsRegistry registry) {
        super(config);
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public String name() {
        return "adaptive";
    }

    @Override
    public void onSuccess(ErrorContext context) {
        metricsFor(context).record(true, lastLatency(context));
    }

    @Override
    public void onFailure(ErrorContext context) {
        metricsFor(context).record(false, lastLatency(context));
    }

    @Override
    protected boolean allowsRetry(ErrorContext context) {
        AdaptiveMetrics metrics = metricsFor(context);
        if (metrics.sampleCount() >= config.minSamples() && metrics.successRate() < config.successFloor()) {
            log.info("Success rate for {} is {} over {} samples, giving up on {} early", context.resourceKey(),
                    metrics.successRate(), metrics.sampleCount(), context.operationName());
            return false;
        }
        return true;
    }

    @Override
    protected Duration computeDelay(ErrorContext context) {
        double successRate = metricsFor(context).successRate();
        Duration jittered = jitter(delayFor(context.failedAttemptCount(), successRate), config.jitterFraction());
        return clamp(jittered);
    }

    /**
     * Delay before jitter. Non-increasing in {@code successRate} for a fixed attempt count.
     */
    Duration delayFor(int failedAttempts, double successRate) {
        double rate = Math.max(0.0, Math.min(1.0, successRate));
        double multiplier = MAX_MULTIPLIER - (MAX_MULTIPLIER - MIN_MULTIPLIER) * rate;
        double base = config.baseDelay().toMillis() * Math.pow(config.backoffFactor(),
                Math.max(0, failedAttempts - 1));
        return clamp(Duration.ofMillis((long) Math.min(base * multiplier, config.maxDelay().toMillis())));
    }

    private Duration clamp(Duration delay) {
        return min(max(delay, config.baseDelay()), config.maxDelay());
    }

    private AdaptiveMetrics metricsFor(ErrorContext context) {
        return registry.metricsFor(context.resourceKey(), config.windowSize());
    }

    private Duration lastLatency(ErrorContext context) {
        AttemptRecord last = context.lastAttempt();
        return last == null ? Duration.ZERO : last.duration();
    }
}
