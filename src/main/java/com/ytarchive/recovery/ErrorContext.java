package com.ytarchive.recovery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One logical operation under retry: what is being done, to which resource, and every attempt made
 * so far. Owned by a single call stack; attempts are appended strictly in order.
 */
public final class ErrorContext {

    private final String operationName;
    private final String resourceId;
    private final String resourceKey;
    private final String traceId;
    private final UUID jobId;
    private final List<AttemptRecord> attempts = new ArrayList<>();

    private ErrorContext(Builder builder) {
        this.operationName = builder.operationName;
        this.resourceId = builder.resourceId;
        this.resourceKey = builder.resourceKey != null ? builder.resourceKey : builder.resourceId;
        this.traceId = builder.traceId != null ? builder.traceId : UUID.randomUUID().toString();
        this.jobId = builder.jobId;
    }

    public static ErrorContext of(String operationName, String resourceId) {
        return builder(operationName, resourceId).build();
    }

    public static Builder builder(String operationName, String resourceId) {
        return new Builder(operationName, resourceId);
    }

    public String operationName() {
        return operationName;
    }

    public String resourceId() {
        return resourceId;
    }

    /**
     * Key under which circuit breaker and adaptive state is shared. Defaults to the resource id.
     */
    public String resourceKey() {
        return resourceKey;
    }

    public String traceId() {
        return traceId;
    }

    public UUID jobId() {
        return jobId;
    }

    /**
     * Identity used to keep at most one active recovery per operation and resource.
     */
    public String operationKey() {
        return operationName + "::" + resourceId;
    }

    public synchronized int attemptCount() {
        return attempts.size();
    }

    public synchronized int failedAttemptCount() {
        int failed = 0;
        for (AttemptRecord attempt : attempts) {
            if (!attempt.succeeded()) {
                failed++;
            }
        }
        return failed;
    }

    public synchronized List<AttemptRecord> attempts() {
        return List.copyOf(attempts);
    }

    public synchronized AttemptRecord lastAttempt() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    /**
     * Reason of the most recent failed attempt, or {@code null} when nothing failed yet.
     */
    public synchronized RetryReason lastReason() {
        AttemptRecord last = lastAttempt();
        return last == null || last.succeeded() ? null : last.reason();
    }

    public synchronized List<Duration> appliedDelays() {
        List<Duration> delays = new ArrayList<>();
        for (AttemptRecord attempt : attempts) {
            if (!attempt.succeeded() && !attempt.delayApplied().isZero()) {
                delays.add(attempt.delayApplied());
            }
        }
        return delays;
    }

    public synchronized AttemptRecord recordSuccess(Instant startedAt, Duration duration) {
        AttemptRecord record = AttemptRecord.success(attempts.size() + 1, startedAt, duration);
        attempts.add(record);
        return record;
    }

    public synchronized AttemptRecord recordFailure(Instant startedAt, Duration duration, Exception exception,
            RetryReason reason, Duration retryAfter) {
        AttemptRecord record = AttemptRecord.failure(attempts.size() + 1, startedAt, duration, exception, reason,
                retryAfter);
        attempts.add(record);
        return record;
    }

    public synchronized void recordDelay(Duration delay) {
        if (attempts.isEmpty()) {
            return;
        }
        int last = attempts.size() - 1;
        attempts.set(last, attempts.get(last).withDelayApplied(delay));
    }

    @Override
    public String toString() {
        return "ErrorContext{operation=" + operationName + ", resource=" + resourceId + ", trace=" + traceId
                + ", attempts=" + attemptCount() + "}";
    }

    public static final class Builder {
        private final String operationName;
        private final String resourceId;
        private String resourceKey;
        private String traceId;
        private UUID jobId;

        private Builder(String operationName, String resourceId) {
            this.operationName = requireText(operationName, "operationName");
            this.resourceId = requireText(resourceId, "resourceId");
        }

        public Builder resourceKey(String resourceKey) {
            this.resourceKey = resourceKey;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder jobId(UUID jobId) {
            this.jobId = jobId;
            return this;
        }

        public ErrorContext build() {
            return new ErrorContext(this);
        }

        private static String requireText(String value, String name) {
            Objects.requireNonNull(value, name);
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return trimmed;
        }
    }
}
