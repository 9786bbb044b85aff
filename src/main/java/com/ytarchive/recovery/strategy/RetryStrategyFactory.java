package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.RetryStrategy;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds strategies by type, wiring the stateful ones to shared registries.
 */
public class RetryStrategyFactory {

    private final CircuitBreakerRegistry circuitBreakers;
    private final AdaptiveMetricsRegistry adaptiveMetrics;
    private final Clock clock;

    public RetryStrategyFactory(CircuitBreakerRegistry circuitBreakers, AdaptiveMetricsRegistry adaptiveMetrics,
            Clock clock) {
        this.circuitBreakers = Objects.requireNonNull(circuitBreakers, "circuitBreakers");
        this.adaptiveMetrics = Objects.requireNonNull(adaptiveMetrics, "adaptiveMetrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RetryStrategy create(StrategyType type, RetryConfig config) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case FIXED_DELAY -> new FixedDelayStrategy(config);
            case EXPONENTIAL_BACKOFF -> new ExponentialBackoffStrategy(config);
            case CIRCUIT_BREAKER -> new CircuitBreakerStrategy(config, circuitBreakers, clock);
            case ADAPTIVE -> new AdaptiveStrategy(config, adaptiveMetrics);
        };
    }
}
