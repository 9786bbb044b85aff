package com.ytarchive.recovery;

import com.ytarchive.MutableClock;
import com.ytarchive.recovery.handler.StorageErrorHandler;
import com.ytarchive.recovery.strategy.AdaptiveMetricsRegistry;
import com.ytarchive.recovery.strategy.CircuitBreakerRegistry;
import com.ytarchive.recovery.strategy.CircuitBreakerState;
import com.ytarchive.recovery.strategy.StrategyType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorRecoveryManagerTest {

    private final List<ErrorReport> persisted = new CopyOnWriteArrayList<>();
    private ErrorReporter reporter;
    private ErrorRecoveryManager manager;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        reporter = new ErrorReporter(persisted::add);
        manager = new ErrorRecoveryManager(reporter);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RetryStrategy backoff(int maxAttempts, Duration baseDelay) {
        return manager.strategies().create(StrategyType.EXPONENTIAL_BACKOFF, RetryConfig.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .jitterFraction(0)
                .build());
    }

    @Test
    void shouldReturnValueAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        ErrorContext context = ErrorContext.of("download_video", "dQw4w9WgXcQ");

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new SocketTimeoutException("read timed out");
            }
            return "saved";
        }, context, backoff(3, Duration.ofMillis(10)));

        assertTrue(result.isSuccess());
        assertEquals("saved", result.value());
        assertEquals(3, result.attemptCount());
        assertThat(context.appliedDelays()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
        assertThat(result.attempts()).extracting(AttemptRecord::reason)
                .containsExactly(RetryReason.NETWORK, RetryReason.NETWORK, null);
        assertThat(reporter.history()).isEmpty();
        assertThat(manager.getActiveRecoveryCount()).isZero();
    }

    @Test
    void shouldReportWhenRetriesAreExhausted() {
        AtomicInteger calls = new AtomicInteger();

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, ErrorContext.of("download_video", "abc"), backoff(3, Duration.ofMillis(5)));

        assertEquals(RecoveryOutcome.EXHAUSTED, result.outcome());
        assertEquals(RecoveryStatus.FAILED_RETRYABLE_EXHAUSTED, result.outcome().status());
        assertEquals(3, calls.get());
        assertEquals(RetryReason.NETWORK, result.reason());
        assertNotNull(result.reportId());
        assertThat(persisted).hasSize(1);
        assertThat(persisted.get(0).attempts()).hasSize(3);
        assertEquals(ErrorSeverity.MEDIUM, persisted.get(0).severity());
    }

    @Test
    void shouldStopAfterOneAttemptForPermanentFailures() {
        AtomicInteger calls = new AtomicInteger();

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new CollaboratorException("metadata", 404, "Video unavailable");
        }, ErrorContext.of("fetch_video_metadata", "abc"), backoff(5, Duration.ofMillis(5)));

        assertEquals(RecoveryOutcome.NON_RETRYABLE, result.outcome());
        assertEquals(1, calls.get());
        assertTrue(result.isPermanentlyUnavailable());
        assertEquals(ErrorSeverity.HIGH, reporter.history().get(0).severity());
        assertThat(reporter.history().get(0).recoveryPossible()).isFalse();
    }

    @Test
    void shouldStopWhenHandlerTakesOverTheFailure() {
        AtomicInteger calls = new AtomicInteger();

        RecoveryResult<Void> result = manager.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new IOException("No space left on device");
        }, ErrorContext.of("record_video_saved", "abc"), backoff(5, Duration.ofMillis(5)),
                new StorageErrorHandler());

        assertEquals(RecoveryOutcome.HANDLED, result.outcome());
        assertEquals(RecoveryStatus.FAILED_NONRETRYABLE, result.outcome().status());
        assertEquals(1, calls.get());
        ErrorReport report = reporter.history().get(0);
        assertEquals(ErrorSeverity.CRITICAL, report.severity());
        assertThat(report.suggestedActions()).contains("Free up disk space on the archive volume");
    }

    @Test
    void shouldFailFastWhileCircuitIsOpen() {
        RetryStrategy strategy = manager.strategies().create(StrategyType.CIRCUIT_BREAKER, RetryConfig.builder()
                .maxAttempts(5)
                .baseDelay(Duration.ofMillis(5))
                .failureThreshold(1)
                .resetTimeout(Duration.ofHours(1))
                .build());
        AtomicInteger calls = new AtomicInteger();
        RecoverableOperation<String> failing = () -> {
            calls.incrementAndGet();
            throw new SocketTimeoutException("timed out");
        };

        RecoveryResult<String> first = manager.executeWithRetry(failing,
                ErrorContext.builder("check_exists", "a").resourceKey("storage").build(), strategy);
        RecoveryResult<String> second = manager.executeWithRetry(failing,
                ErrorContext.builder("check_exists", "b").resourceKey("storage").build(), strategy);

        assertEquals(RecoveryOutcome.EXHAUSTED, first.outcome());
        assertEquals(RecoveryOutcome.CIRCUIT_OPEN, second.outcome());
        assertInstanceOf(CircuitOpenException.class, second.failure());
        assertEquals(0, second.attemptCount());
        assertNull(second.reportId());
        assertEquals(1, calls.get());
        assertThat(reporter.history()).hasSize(1);
    }

    @Test
    void shouldReportLastFailureWhenCircuitOpensDuringBackoff() throws Exception {
        RetryStrategy strategy = manager.strategies().create(StrategyType.CIRCUIT_BREAKER, RetryConfig.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(300))
                .jitterFraction(0)
                .failureThreshold(2)
                .resetTimeout(Duration.ofHours(1))
                .build());
        CountDownLatch backoffStarted = new CountDownLatch(1);
        RetryListener listener = new RetryListener() {
            @Override
            public void onBackoffStarted(ErrorContext context, Duration delay) {
                backoffStarted.countDown();
            }
        };
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<RecoveryResult<String>> waiting = CompletableFuture.supplyAsync(() ->
                manager.executeWithRetry(() -> {
                    calls.incrementAndGet();
                    throw new SocketTimeoutException("read timed out");
                }, ErrorContext.builder("record_video_saved", "a").resourceKey("storage").build(), strategy, null,
                        CancellationToken.none(), listener), executor);
        assertTrue(backoffStarted.await(5, TimeUnit.SECONDS));

        RecoveryResult<String> tripping = manager.executeWithRetry(() -> {
            throw new SocketTimeoutException("write timed out");
        }, ErrorContext.builder("record_video_saved", "b").resourceKey("storage").build(), strategy);
        RecoveryResult<String> rejected = waiting.get(5, TimeUnit.SECONDS);

        assertEquals(RecoveryOutcome.EXHAUSTED, tripping.outcome());
        assertEquals(RecoveryOutcome.CIRCUIT_OPEN, rejected.outcome());
        assertEquals(1, calls.get());
        assertEquals(1, rejected.attemptCount());
        assertEquals(RetryReason.NETWORK, rejected.reason());
        assertInstanceOf(SocketTimeoutException.class, rejected.failure());
        assertEquals("read timed out", rejected.failureMessage());
        assertThat(rejected.failure().getSuppressed()).hasSize(1);
        assertInstanceOf(CircuitOpenException.class, rejected.failure().getSuppressed()[0]);
        assertNotNull(rejected.reportId());
        assertThat(reporter.history()).hasSize(2);
        ErrorReport report = reporter.history().stream()
                .filter(candidate -> candidate.id().equals(rejected.reportId()))
                .findFirst()
                .orElseThrow();
        assertEquals("a", report.resourceId());
        assertEquals(RetryReason.NETWORK, report.reason());
        assertThat(report.attempts()).hasSize(1);
    }

    @Test
    void shouldReleaseHalfOpenTrialWhenOperationThrowsError() {
        MutableClock clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
        CircuitBreakerRegistry circuitBreakers = new CircuitBreakerRegistry();
        ErrorRecoveryManager clocked = new ErrorRecoveryManager(reporter, circuitBreakers,
                new AdaptiveMetricsRegistry(), clock);
        RetryStrategy strategy = clocked.strategies().create(StrategyType.CIRCUIT_BREAKER, RetryConfig.builder()
                .maxAttempts(1)
                .failureThreshold(1)
                .resetTimeout(Duration.ofSeconds(10))
                .build());

        clocked.executeWithRetry(() -> {
            throw new SocketTimeoutException("timed out");
        }, ErrorContext.builder("check_exists", "a").resourceKey("storage").build(), strategy);
        clock.advance(Duration.ofSeconds(11));

        assertThrows(AssertionError.class, () -> clocked.executeWithRetry(() -> {
            throw new AssertionError("corrupted state");
        }, ErrorContext.builder("check_exists", "b").resourceKey("storage").build(), strategy));
        RecoveryResult<String> next = clocked.executeWithRetry(() -> "ok",
                ErrorContext.builder("check_exists", "c").resourceKey("storage").build(), strategy);

        assertTrue(next.isSuccess());
        assertEquals(CircuitBreakerState.State.CLOSED, circuitBreakers.find("storage").getState());
        assertThat(clocked.getActiveRecoveryCount()).isZero();
    }

    @Test
    void shouldCancelDuringBackoffWithoutReporting() {
        CancellationToken token = new CancellationToken();
        CountDownLatch backoffStarted = new CountDownLatch(1);
        RetryListener listener = new RetryListener() {
            @Override
            public void onBackoffStarted(ErrorContext context, Duration delay) {
                backoffStarted.countDown();
            }
        };

        CompletableFuture<RecoveryResult<String>> future = CompletableFuture.supplyAsync(() ->
                manager.executeWithRetry(() -> {
                    throw new SocketTimeoutException("timed out");
                }, ErrorContext.of("download_video", "abc"), backoff(5, Duration.ofMinutes(1)), null, token,
                        listener), executor);

        await().atMost(5, TimeUnit.SECONDS).until(() -> backoffStarted.getCount() == 0);
        long cancelledAt = System.nanoTime();
        token.cancel();
        RecoveryResult<String> result = future.join();

        assertTrue(result.isCancelled());
        assertEquals(RecoveryStatus.CANCELLED, result.outcome().status());
        assertThat(Duration.ofNanos(System.nanoTime() - cancelledAt)).isLessThan(Duration.ofSeconds(5));
        assertThat(reporter.history()).isEmpty();
        assertThat(manager.getActiveRecoveryCount()).isZero();
    }

    @Test
    void shouldNotInvokeOperationWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            calls.incrementAndGet();
            return "never";
        }, ErrorContext.of("download_video", "abc"), backoff(3, Duration.ofMillis(5)), null, token);

        assertTrue(result.isCancelled());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldTreatInterruptionAsCancellation() {
        try {
            RecoveryResult<String> result = manager.executeWithRetry(() -> {
                throw new InterruptedException("stop");
            }, ErrorContext.of("download_video", "abc"), backoff(3, Duration.ofMillis(5)));

            assertTrue(result.isCancelled());
            assertEquals(0, result.attemptCount());
            assertThat(reporter.history()).isEmpty();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRunOneRecoveryPerOperationAndResource() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        RecoverableOperation<Integer> blocking = () -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
                return calls.incrementAndGet();
            } finally {
                running.decrementAndGet();
            }
        };
        RetryStrategy strategy = backoff(3, Duration.ofMillis(5));

        CompletableFuture<RecoveryResult<Integer>> first = CompletableFuture.supplyAsync(() ->
                manager.executeWithRetry(blocking, ErrorContext.of("download_video", "abc"), strategy), executor);
        await().atMost(5, TimeUnit.SECONDS).until(() -> running.get() == 1);

        CompletableFuture<RecoveryResult<Integer>> second = CompletableFuture.supplyAsync(() ->
                manager.executeWithRetry(blocking, ErrorContext.of("download_video", "abc"), strategy), executor);
        Thread.sleep(200);

        List<RecoverySnapshot> active = manager.getActiveRecoveries();
        assertThat(active).hasSize(1);
        assertEquals("download_video", active.get(0).operationName());
        assertEquals("abc", active.get(0).resourceId());
        assertEquals("exponential-backoff", active.get(0).strategyName());
        assertEquals(RecoveryStatus.ACTIVE, active.get(0).status());
        assertThat(second).isNotDone();

        release.countDown();

        assertEquals(1, first.get(5, TimeUnit.SECONDS).value());
        assertEquals(2, second.get(5, TimeUnit.SECONDS).value());
        assertEquals(1, maxRunning.get());
        assertThat(manager.getActiveRecoveries()).isEmpty();
    }

    @Test
    void shouldNotifyListenersAroundBackoffAndOnOutcome() {
        List<String> events = new CopyOnWriteArrayList<>();
        List<RecoveryOutcome> outcomes = new CopyOnWriteArrayList<>();
        manager.addOutcomeListener(outcomes::add);
        manager.addOutcomeListener(outcome -> {
            throw new IllegalStateException("listener bug");
        });
        RetryListener listener = new RetryListener() {
            @Override
            public void onBackoffStarted(ErrorContext context, Duration delay) {
                events.add("started:" + delay.toMillis());
            }

            @Override
            public void onBackoffFinished(ErrorContext context) {
                events.add("finished");
            }
        };
        AtomicInteger calls = new AtomicInteger();

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new CollaboratorException("download", 503, "Service Unavailable");
            }
            return "ok";
        }, ErrorContext.of("download_video", "abc"), backoff(3, Duration.ofMillis(15)), null,
                CancellationToken.none(), listener);

        assertTrue(result.isSuccess());
        assertThat(events).containsExactly("started:15", "finished");
        assertThat(outcomes).containsExactly(RecoveryOutcome.SUCCEEDED);
    }

    @Test
    void shouldHonourRetryAfterHint() {
        AtomicInteger calls = new AtomicInteger();
        ErrorContext context = ErrorContext.of("fetch_video_metadata", "abc");

        RecoveryResult<String> result = manager.executeWithRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new CollaboratorException("metadata", 429, "Too Many Requests", Duration.ofMillis(80));
            }
            return "ok";
        }, context, backoff(3, Duration.ofMillis(5)));

        assertTrue(result.isSuccess());
        assertEquals(RetryReason.RATE_LIMIT, result.attempts().get(0).reason());
        assertThat(context.appliedDelays()).containsExactly(Duration.ofMillis(80));
    }
}
