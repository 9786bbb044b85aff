package com.ytarchive.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by everything working on one job. Backoff waits block on
 * the token instead of sleeping so that a cancel wakes them immediately.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Cancels the token. Only the first call runs the registered callbacks.
     *
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel() {
        synchronized (cancelled) {
            if (isCancelled()) {
                return false;
            }
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException callbackFailure) {
                log.warn("Cancellation callback failed", callbackFailure);
            }
        }
        return true;
    }

    /**
     * Registers a callback run on cancellation. Runs immediately when the token is already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (cancelled) {
            if (!isCancelled()) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * Waits for the given delay unless the token is cancelled first.
     *
     * @return {@code true} when the full delay elapsed, {@code false} when cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return !isCancelled();
        }
        return !cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RecoveryCancelledException("Operation cancelled");
        }
    }
}
