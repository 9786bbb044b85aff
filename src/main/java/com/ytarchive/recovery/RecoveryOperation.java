package com.ytarchive.recovery;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One active retry sequence, registered with its manager from start until a terminal status.
 */
public final class RecoveryOperation {

    private final UUID id = UUID.randomUUID();
    private final ErrorContext context;
    private final String strategyName;
    private final Instant startedAt;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile RecoveryStatus status = RecoveryStatus.ACTIVE;

    RecoveryOperation(ErrorContext context, String strategyName, Instant startedAt) {
        this.context = context;
        this.strategyName = strategyName;
        this.startedAt = startedAt;
    }

    public UUID getId() {
        return id;
    }

    public ErrorContext getContext() {
        return context;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RecoveryStatus getStatus() {
        return status;
    }

    void finish(RecoveryStatus terminalStatus) {
        if (terminalStatus == RecoveryStatus.ACTIVE) {
            throw new IllegalArgumentException("ACTIVE is not a terminal status");
        }
        this.status = terminalStatus;
        finished.countDown();
    }

    /**
     * Waits up to {@code timeoutMillis} for the operation to reach a terminal status.
     */
    boolean awaitFinished(long timeoutMillis) throws InterruptedException {
        return finished.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    RecoverySnapshot snapshot() {
        return new RecoverySnapshot(id, context.operationName(), context.resourceId(), context.traceId(),
                context.jobId(), strategyName, status, context.attemptCount(), startedAt);
    }
}
