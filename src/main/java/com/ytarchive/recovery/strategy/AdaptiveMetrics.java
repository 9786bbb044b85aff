package com.ytarchive.recovery.strategy;

import java.time.Duration;

/**
 * Rolling outcome history for one resource key, kept in a fixed-capacity ring buffer. Inserting
 * into a full window overwrites the oldest sample.
 */
public final class AdaptiveMetrics {

    private final boolean[] outcomes;
    private final long[] latencyNanos;
    private int next;
    private int size;
    private int successes;

    public AdaptiveMetrics(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.outcomes = new boolean[capacity];
        this.latencyNanos = new long[capacity];
    }

    public synchronized void record(boolean success, Duration latency) {
        if (size == outcomes.length) {
            if (outcomes[next]) {
                successes--;
            }
        } else {
            size++;
        }
        outcomes[next] = success;
        latencyNanos[next] = latency == null ? 0L : latency.toNanos();
        if (success) {
            successes++;
        }
        next = (next + 1) % outcomes.length;
    }

    /**
     * Share of successful samples in the window; {@code 1.0} while the window is empty.
     */
    public synchronized double successRate() {
        return size == 0 ? 1.0 : (double) successes / size;
    }

    public synchronized int sampleCount() {
        return size;
    }

    public int capacity() {
        return outcomes.length;
    }

    public synchronized Duration averageLatency() {
        if (size == 0) {
            return Duration.ZERO;
        }
        long total = 0L;
        for (int i = 0; i < size; i++) {
            total += latencyNanos[i];
        }
        return Duration.ofNanos(total / size);
    }
}
