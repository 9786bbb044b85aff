package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff gated by a per-resource {@link CircuitBreakerState}. While the circuit is
 * open, attempts are refused up front and failed attempts are not retried, so callers fail fast
 * with no delay.
 */
public class CircuitBreakerStrategy extends AbstractRetryStrategy {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerStrategy.class);

    private final CircuitBreakerRegistry registry;
    private final Clock clock;

    public CircuitBreakerStrategy(RetryConfig config, CircuitBreakerRegistry registry, Clock clock) {
        super(config);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return "circuit-breaker";
    }

    @Override
    public boolean permitsAttempt(ErrorContext context) {
        boolean permitted = stateFor(context).tryAcquirePermission(clock.instant());
        if (!permitted) {
            log.debug("Circuit for {} is open, rejecting attempt of {}", context.resourceKey(),
                    context.operationName());
        }
        return permitted;
    }

    @Override
    public void onSuccess(ErrorContext context) {
        stateFor(context).recordSuccess();
    }

    @Override
    public void onFailure(ErrorContext context) {
        CircuitBreakerState state = stateFor(context);
        CircuitBreakerState.State before = state.getState();
        state.recordFailure(clock.instant());
        CircuitBreakerState.State after = state.getState();
        if (before != after) {
            log.warn("Circuit for {} moved {} -> {} after {} consecutive failures", context.resourceKey(), before,
                    after, state.getConsecutiveFailures());
        }
    }

    @Override
    public void onAbandoned(ErrorContext context) {
        stateFor(context).releaseTrial();
    }

    @Override
    protected boolean allowsRetry(ErrorContext context) {
        return stateFor(context).getState() == CircuitBreakerState.State.CLOSED;
    }

    @Override
    protected Duration computeDelay(ErrorContext context) {
        return jitter(exponentialDelay(context.failedAttemptCount()), config.jitterFraction());
    }

    private CircuitBreakerState stateFor(ErrorContext context) {
        return registry.stateFor(context.resourceKey(), config.failureThreshold(), config.resetTimeout());
    }
}
