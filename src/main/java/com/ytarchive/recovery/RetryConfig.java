package com.ytarchive.recovery;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable tuning for a single {@link RetryStrategy} instance.
 *
 * <p>Circuit breaker and adaptive settings live here as well so that one config type can be
 * handed to any strategy; variants simply ignore the fields they do not use.
 */
public final class RetryConfig {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final double jitterFraction;
    private final Set<RetryReason> retryableReasons;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int windowSize;
    private final int minSamples;
    private final double successFloor;

    private RetryConfig(Builder builder) {
        if (builder.maxDelay.compareTo(builder.baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (builder.minSamples > builder.windowSize) {
            throw new IllegalArgumentException("minSamples must be <= windowSize");
        }
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffFactor = builder.backoffFactor;
        this.jitterFraction = builder.jitterFraction;
        this.retryableReasons = Collections.unmodifiableSet(EnumSet.copyOf(builder.retryableReasons));
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeout = builder.resetTimeout;
        this.windowSize = builder.windowSize;
        this.minSamples = builder.minSamples;
        this.successFloor = builder.successFloor;
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffFactor(backoffFactor)
                .jitterFraction(jitterFraction)
                .retryableReasons(retryableReasons)
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .windowSize(windowSize)
                .minSamples(minSamples)
                .successFloor(successFloor);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double backoffFactor() {
        return backoffFactor;
    }

    public double jitterFraction() {
        return jitterFraction;
    }

    public Set<RetryReason> retryableReasons() {
        return retryableReasons;
    }

    public boolean isRetryable(RetryReason reason) {
        return reason != null && retryableReasons.contains(reason);
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration resetTimeout() {
        return resetTimeout;
    }

    public int windowSize() {
        return windowSize;
    }

    public int minSamples() {
        return minSamples;
    }

    public double successFloor() {
        return successFloor;
    }

    @Override
    public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts
                + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay
                + ", backoffFactor=" + backoffFactor
                + ", jitterFraction=" + jitterFraction
                + ", retryableReasons=" + retryableReasons + "}";
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double backoffFactor = 2.0;
        private double jitterFraction = 0.1;
        private Set<RetryReason> retryableReasons = defaultRetryableReasons();
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private int windowSize = 10;
        private int minSamples = 5;
        private double successFloor = 0.1;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            Objects.requireNonNull(baseDelay, "baseDelay");
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            if (backoffFactor < 1.0) {
                throw new IllegalArgumentException("backoffFactor must be >= 1.0");
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            if (jitterFraction < 0 || jitterFraction > 1.0) {
                throw new IllegalArgumentException("jitterFraction must be 0.0-1.0");
            }
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder retryableReasons(Set<RetryReason> retryableReasons) {
            Objects.requireNonNull(retryableReasons, "retryableReasons");
            this.retryableReasons = retryableReasons.isEmpty()
                    ? EnumSet.noneOf(RetryReason.class)
                    : EnumSet.copyOf(retryableReasons);
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder resetTimeout(Duration resetTimeout) {
            Objects.requireNonNull(resetTimeout, "resetTimeout");
            if (resetTimeout.isNegative()) {
                throw new IllegalArgumentException("resetTimeout must not be negative");
            }
            this.resetTimeout = resetTimeout;
            return this;
        }

        public Builder windowSize(int windowSize) {
            if (windowSize < 1) {
                throw new IllegalArgumentException("windowSize must be >= 1");
            }
            this.windowSize = windowSize;
            return this;
        }

        public Builder minSamples(int minSamples) {
            if (minSamples < 1) {
                throw new IllegalArgumentException("minSamples must be >= 1");
            }
            this.minSamples = minSamples;
            return this;
        }

        public Builder successFloor(double successFloor) {
            if (successFloor < 0 || successFloor > 1.0) {
                throw new IllegalArgumentException("successFloor must be 0.0-1.0");
            }
            this.successFloor = successFloor;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(this);
        }

        private static Set<RetryReason> defaultRetryableReasons() {
            EnumSet<RetryReason> reasons = EnumSet.noneOf(RetryReason.class);
            for (RetryReason reason : RetryReason.values()) {
                if (reason.isRetryableByDefault()) {
                    reasons.add(reason);
                }
            }
            return reasons;
        }
    }
}
