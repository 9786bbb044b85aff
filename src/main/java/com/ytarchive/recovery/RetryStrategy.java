package com.ytarchive.recovery;

/**
 * Decides whether a failed operation is attempted again and how long to wait first.
 *
 * <p>Implementations must not throw from any method and must answer {@code retry=false} once
 * {@link RetryConfig#maxAttempts()} attempts have been made. Strategies holding shared state
 * (circuit breaker, adaptive) key it by {@link ErrorContext#resourceKey()}; the outcome hooks are
 * where that state is updated, {@link #nextDecision(ErrorContext)} only reads it.
 */
public interface RetryStrategy {

    /**
     * Short name used in logs and recovery snapshots.
     */
    String name();

    RetryConfig config();

    /**
     * Called after a failed attempt has been appended to the context and reported through
     * {@link #onFailure(ErrorContext)}.
     */
    RetryDecision nextDecision(ErrorContext context);

    /**
     * Called before every invocation. Returning {@code false} rejects the attempt without invoking
     * the operation.
     */
    default boolean permitsAttempt(ErrorContext context) {
        return true;
    }

    /**
     * Called after a successful attempt has been appended to the context.
     */
    default void onSuccess(ErrorContext context) {
        // stateless strategies have nothing to record
    }

    /**
     * Called after a failed attempt has been appended to the context, whether or not the generic
     * retry loop goes on to consult {@link #nextDecision(ErrorContext)}.
     */
    default void onFailure(ErrorContext context) {
        // stateless strategies have nothing to record
    }

    /**
     * Called when a permitted attempt was abandoned without an outcome (cancellation).
     */
    default void onAbandoned(ErrorContext context) {
        // stateless strategies have nothing to record
    }
}
