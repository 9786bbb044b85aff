package com.ytarchive.recovery;

import com.ytarchive.recovery.strategy.AdaptiveMetricsRegistry;
import com.ytarchive.recovery.strategy.CircuitBreakerRegistry;
import com.ytarchive.recovery.strategy.RetryStrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Runs operations under a {@link RetryStrategy}, classifying each failure, waiting out backoffs
 * cancellably and reporting terminal failures. At most one recovery is active per operation and
 * resource; a second caller for the same pair waits until the first finishes.
 */
public class ErrorRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryManager.class);

    private static final long REGISTRATION_POLL_MILLIS = 50;

    private final ErrorReporter reporter;
    private final CircuitBreakerRegistry circuitBreakers;
    private final AdaptiveMetricsRegistry adaptiveMetrics;
    private final Clock clock;
    private final ErrorClassifier defaultClassifier = new DefaultErrorClassifier();
    private final Map<String, RecoveryOperation> activeOperations = new ConcurrentHashMap<>();
    private final List<Consumer<RecoveryOutcome>> outcomeListeners = new CopyOnWriteArrayList<>();
    private final RetryStrategyFactory strategyFactory;

    public ErrorRecoveryManager(ErrorReporter reporter) {
        this(reporter, new CircuitBreakerRegistry(), new AdaptiveMetricsRegistry(), Clock.systemUTC());
    }

    public ErrorRecoveryManager(ErrorReporter reporter, CircuitBreakerRegistry circuitBreakers,
            AdaptiveMetricsRegistry adaptiveMetrics, Clock clock) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.circuitBreakers = Objects.requireNonNull(circuitBreakers, "circuitBreakers");
        this.adaptiveMetrics = Objects.requireNonNull(adaptiveMetrics, "adaptiveMetrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.strategyFactory = new RetryStrategyFactory(circuitBreakers, adaptiveMetrics, clock);
    }

    /**
     * Factory for strategies that share this manager's circuit breaker and adaptive state.
     */
    public RetryStrategyFactory strategies() {
        return strategyFactory;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public AdaptiveMetricsRegistry getAdaptiveMetrics() {
        return adaptiveMetrics;
    }

    public ErrorReporter getReporter() {
        return reporter;
    }

    public void addOutcomeListener(Consumer<RecoveryOutcome> listener) {
        outcomeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public <T> RecoveryResult<T> executeWithRetry(RecoverableOperation<T> operation, ErrorContext context,
            RetryStrategy strategy) {
        return executeWithRetry(operation, context, strategy, null, CancellationToken.none(), RetryListener.NONE);
    }

    public <T> RecoveryResult<T> executeWithRetry(RecoverableOperation<T> operation, ErrorContext context,
            RetryStrategy strategy, ServiceErrorHandler handler) {
        return executeWithRetry(operation, context, strategy, handler, CancellationToken.none(), RetryListener.NONE);
    }

    public <T> RecoveryResult<T> executeWithRetry(RecoverableOperation<T> operation, ErrorContext context,
            RetryStrategy strategy, ServiceErrorHandler handler, CancellationToken cancellation) {
        return executeWithRetry(operation, context, strategy, handler, cancellation, RetryListener.NONE);
    }

    /**
     * Invokes {@code operation} until it succeeds, the strategy stops, the handler takes over or the
     * call is cancelled. Terminal failures are returned, never thrown.
     *
     * @param handler collaborator handler, or {@code null} to classify with the default classifier
     */
    public <T> RecoveryResult<T> executeWithRetry(RecoverableOperation<T> operation, ErrorContext context,
            RetryStrategy strategy, ServiceErrorHandler handler, CancellationToken cancellation,
            RetryListener listener) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(strategy, "strategy");
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        RetryListener retryListener = listener != null ? listener : RetryListener.NONE;

        RecoveryOperation recovery;
        try {
            recovery = register(context, strategy, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(context, e);
        }
        if (recovery == null) {
            return cancelled(context, null);
        }

        RecoveryOutcome outcome = RecoveryOutcome.CANCELLED;
        try {
            RecoveryResult<T> result = runAttempts(operation, context, strategy, handler, token, retryListener);
            outcome = result.outcome();
            return result;
        } finally {
            activeOperations.remove(context.operationKey(), recovery);
            recovery.finish(outcome.status());
            notifyOutcome(outcome);
        }
    }

    /**
     * Immutable snapshot of the recoveries currently in flight.
     */
    public List<RecoverySnapshot> getActiveRecoveries() {
        List<RecoverySnapshot> snapshots = new ArrayList<>();
        for (RecoveryOperation operation : activeOperations.values()) {
            snapshots.add(operation.snapshot());
        }
        return List.copyOf(snapshots);
    }

    public int getActiveRecoveryCount() {
        return activeOperations.size();
    }

    private RecoveryOperation register(ErrorContext context, RetryStrategy strategy, CancellationToken token)
            throws InterruptedException {
        RecoveryOperation candidate = new RecoveryOperation(context, strategy.name(), clock.instant());
        String key = context.operationKey();
        boolean waited = false;
        while (true) {
            if (token.isCancelled()) {
                return null;
            }
            RecoveryOperation existing = activeOperations.putIfAbsent(key, candidate);
            if (existing == null) {
                return candidate;
            }
            if (!waited) {
                log.debug("Recovery for {} already active ({}), waiting", key, existing.getId());
                waited = true;
            }
            existing.awaitFinished(REGISTRATION_POLL_MILLIS);
        }
    }

    private <T> RecoveryResult<T> runAttempts(RecoverableOperation<T> operation, ErrorContext context,
            RetryStrategy strategy, ServiceErrorHandler handler, CancellationToken token, RetryListener listener) {
        ErrorClassifier classifier = handler != null ? handler : defaultClassifier;
        Exception lastFailure = null;
        while (true) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                return cancelled(context, null);
            }
            if (!permitsAttempt(strategy, context)) {
                return circuitOpen(context, strategy, handler, lastFailure);
            }

            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();
            T value;
            try {
                value = operation.call();
            } catch (Exception failure) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                if (isCancellation(failure, token)) {
                    strategy.onAbandoned(context);
                    return cancelled(context, failure);
                }

                lastFailure = failure;
                RetryReason reason = classify(classifier, failure);
                context.recordFailure(startedAt, elapsed, failure, reason, retryAfter(classifier, failure));
                notifyFailure(strategy, context);
                log.debug("Attempt {} of {} on {} failed ({}): {}", context.attemptCount(),
                        context.operationName(), context.resourceId(), reason, failure.getMessage());

                if (handler != null && handledByCollaborator(handler, failure, context)) {
                    String reportId = reporter.report(context, failure, reason, ErrorSeverity.CRITICAL,
                            suggestions(handler, context));
                    log.error("{} on {} escalated by {} handler: {}", context.operationName(),
                            context.resourceId(), handler.serviceName(), failure.getMessage());
                    return new RecoveryResult<>(RecoveryOutcome.HANDLED, null, failure, reason, reportId,
                            context.attempts());
                }

                RetryDecision decision = strategy.nextDecision(context);
                if (!decision.retry()) {
                    RecoveryOutcome outcome = strategy.config().isRetryable(reason)
                            ? RecoveryOutcome.EXHAUSTED
                            : RecoveryOutcome.NON_RETRYABLE;
                    String reportId = reporter.report(context, failure, reason, ErrorReporter.severityFor(reason),
                            suggestions(handler, context));
                    log.info("{} on {} gave up after {} attempts ({}, {})", context.operationName(),
                            context.resourceId(), context.attemptCount(), outcome, reason);
                    return new RecoveryResult<>(outcome, null, failure, reason, reportId, context.attempts());
                }

                context.recordDelay(decision.delay());
                log.debug("Retrying {} on {} in {} ms", context.operationName(), context.resourceId(),
                        decision.delay().toMillis());
                if (!backoff(context, decision.delay(), token, listener)) {
                    return cancelled(context, null);
                }
                continue;
            } catch (Error fatal) {
                // the attempt produced no outcome, so a half-open trial must not stay claimed
                safely(() -> strategy.onAbandoned(context), strategy.name() + " strategy");
                throw fatal;
            }

            context.recordSuccess(startedAt, Duration.ofNanos(System.nanoTime() - startNanos));
            notifySuccess(strategy, context);
            if (context.attemptCount() > 1) {
                log.info("{} on {} recovered after {} attempts", context.operationName(), context.resourceId(),
                        context.attemptCount());
            }
            return new RecoveryResult<>(RecoveryOutcome.SUCCEEDED, value, null, null, null, context.attempts());
        }
    }

    /**
     * Ends a sequence refused by the strategy. A sequence that already failed at least once is
     * reported with its last failure, carrying the rejection as a suppressed exception. A refusal
     * before the first attempt is not reported: the failures that opened the circuit were reported
     * by the sequences that made them.
     */
    private <T> RecoveryResult<T> circuitOpen(ErrorContext context, RetryStrategy strategy,
            ServiceErrorHandler handler, Exception lastFailure) {
        CircuitOpenException rejection = new CircuitOpenException(context.resourceKey());
        if (lastFailure == null) {
            log.warn("{} on {} rejected by {} for {} before any attempt", context.operationName(),
                    context.resourceId(), strategy.name(), context.resourceKey());
            return new RecoveryResult<>(RecoveryOutcome.CIRCUIT_OPEN, null, rejection, null, null,
                    context.attempts());
        }
        lastFailure.addSuppressed(rejection);
        RetryReason reason = context.lastReason();
        String reportId = reporter.report(context, lastFailure, reason, ErrorReporter.severityFor(reason),
                suggestions(handler, context));
        log.warn("{} on {} rejected by {} for {} after {} attempts", context.operationName(),
                context.resourceId(), strategy.name(), context.resourceKey(), context.attemptCount());
        return new RecoveryResult<>(RecoveryOutcome.CIRCUIT_OPEN, null, lastFailure, reason, reportId,
                context.attempts());
    }

    private boolean backoff(ErrorContext context, Duration delay, CancellationToken token, RetryListener listener) {
        safely(() -> listener.onBackoffStarted(context, delay), "backoff listener");
        try {
            return token.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            safely(() -> listener.onBackoffFinished(context), "backoff listener");
        }
    }

    private boolean permitsAttempt(RetryStrategy strategy, ErrorContext context) {
        try {
            return strategy.permitsAttempt(context);
        } catch (RuntimeException e) {
            log.warn("{} strategy failed to admit attempt for {}, admitting", strategy.name(), context, e);
            return true;
        }
    }

    private void notifyFailure(RetryStrategy strategy, ErrorContext context) {
        safely(() -> strategy.onFailure(context), strategy.name() + " strategy");
    }

    private void notifySuccess(RetryStrategy strategy, ErrorContext context) {
        safely(() -> strategy.onSuccess(context), strategy.name() + " strategy");
    }

    private void notifyOutcome(RecoveryOutcome outcome) {
        for (Consumer<RecoveryOutcome> listener : outcomeListeners) {
            safely(() -> listener.accept(outcome), "outcome listener");
        }
    }

    private RetryReason classify(ErrorClassifier classifier, Exception failure) {
        try {
            RetryReason reason = classifier.classify(failure);
            return reason != null ? reason : RetryReason.UNKNOWN;
        } catch (RuntimeException e) {
            log.warn("Classifier failed on {}, treating as UNKNOWN", failure.getClass().getName(), e);
            return RetryReason.UNKNOWN;
        }
    }

    private Duration retryAfter(ErrorClassifier classifier, Exception failure) {
        try {
            return classifier.retryAfter(failure);
        } catch (RuntimeException e) {
            log.warn("Failed to read retry-after hint from {}", failure.getClass().getName(), e);
            return null;
        }
    }

    private boolean handledByCollaborator(ServiceErrorHandler handler, Exception failure, ErrorContext context) {
        try {
            return handler.handleError(failure, context);
        } catch (RuntimeException e) {
            log.warn("{} handler failed on {}, falling back to retry strategy", handler.serviceName(),
                    failure.getClass().getName(), e);
            return false;
        }
    }

    private List<String> suggestions(ServiceErrorHandler handler, ErrorContext context) {
        if (handler == null) {
            return List.of();
        }
        try {
            List<String> suggestions = handler.getRecoverySuggestions(context);
            return suggestions != null ? suggestions : List.of();
        } catch (RuntimeException e) {
            log.warn("{} handler failed to suggest recovery actions", handler.serviceName(), e);
            return List.of();
        }
    }

    private static boolean isCancellation(Exception failure, CancellationToken token) {
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return true;
        }
        if (failure instanceof RecoveryCancelledException || failure instanceof ClosedByInterruptException) {
            return true;
        }
        if (failure instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
            return true;
        }
        return token.isCancelled();
    }

    private static <T> RecoveryResult<T> cancelled(ErrorContext context, Exception cause) {
        log.debug("{} on {} cancelled after {} attempts", context.operationName(), context.resourceId(),
                context.attemptCount());
        Exception failure = cause != null ? cause : new RecoveryCancelledException("Operation cancelled");
        return new RecoveryResult<>(RecoveryOutcome.CANCELLED, null, failure, context.lastReason(), null,
                context.attempts());
    }

    private static void safely(Runnable action, String what) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("{} failed", what, e);
        }
    }
}
