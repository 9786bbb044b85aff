package com.ytarchive.recovery.strategy;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Failure budget shared by every recovery touching one resource key.
 *
 * <p>All reads and writes happen under a single lock so that concurrent failures are counted as
 * read-modify-write, never lost. Valid transitions are CLOSED to OPEN, OPEN to HALF_OPEN,
 * HALF_OPEN to CLOSED and HALF_OPEN to OPEN.
 */
public final class CircuitBreakerState {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String resourceKey;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreakerState(String resourceKey, int failureThreshold, Duration resetTimeout) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.resourceKey = resourceKey;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
    }

    /**
     * Admits or rejects an attempt. An OPEN circuit whose reset timeout has elapsed moves to
     * HALF_OPEN and admits exactly one trial; further callers are rejected until the trial reports.
     */
    public boolean tryAcquirePermission(Instant now) {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (Duration.between(openedAt, now).compareTo(resetTimeout) < 0) {
                        return false;
                    }
                    transitionTo(State.HALF_OPEN);
                    trialInFlight = true;
                    return true;
                case HALF_OPEN:
                    if (trialInFlight) {
                        return false;
                    }
                    trialInFlight = true;
                    return true;
                default:
                    throw new IllegalStateException("Unknown circuit state " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state == State.HALF_OPEN) {
                transitionTo(State.CLOSED);
                trialInFlight = false;
            }
            if (state == State.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(Instant now) {
        lock.lock();
        try {
            consecutiveFailures++;
            if (state == State.HALF_OPEN) {
                transitionTo(State.OPEN);
                openedAt = now;
                trialInFlight = false;
            } else if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
                transitionTo(State.OPEN);
                openedAt = now;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a trial permit that never produced an outcome.
     */
    public void releaseTrial() {
        lock.lock();
        try {
            if (state == State.HALF_OPEN) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the circuit currently refuses traffic. Does not move OPEN to HALF_OPEN.
     */
    public boolean isRejecting(Instant now) {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> false;
                case OPEN -> Duration.between(openedAt, now).compareTo(resetTimeout) < 0;
                case HALF_OPEN -> trialInFlight;
            };
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(resourceKey, state, consecutiveFailures, openedAt, failureThreshold, resetTimeout);
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    private void transitionTo(State next) {
        boolean valid = switch (state) {
            case CLOSED -> next == State.OPEN;
            case OPEN -> next == State.HALF_OPEN;
            case HALF_OPEN -> next == State.CLOSED || next == State.OPEN;
        };
        if (!valid) {
            throw new IllegalStateException("Invalid circuit transition " + state + " -> " + next + " for "
                    + resourceKey);
        }
        state = next;
    }

    public record Snapshot(
            String resourceKey,
            State state,
            int consecutiveFailures,
            Instant openedAt,
            int failureThreshold,
            Duration resetTimeout) {
    }
}
