package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.RetryReason;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExponentialBackoffStrategyTest {

    private static void fail(ErrorContext context) {
        context.recordFailure(Instant.now(), Duration.ofMillis(5), new SocketTimeoutException("read timed out"),
                RetryReason.NETWORK, null);
    }

    @Test
    void shouldDoubleDelayPerFailedAttempt() {
        ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(RetryConfig.builder()
                .maxAttempts(5)
                .baseDelay(Duration.ofSeconds(1))
                .backoffFactor(2.0)
                .jitterFraction(0)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");

        fail(context);
        assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofSeconds(1));
        fail(context);
        assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofSeconds(2));
        fail(context);
        assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofSeconds(4));
        fail(context);
        assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofSeconds(8));
        fail(context);
        assertThat(strategy.nextDecision(context).retry()).isFalse();
    }

    @Test
    void shouldCapDelayAtMaxDelay() {
        ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(RetryConfig.builder()
                .maxAttempts(10)
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(5))
                .backoffFactor(3.0)
                .jitterFraction(0)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");

        for (int i = 0; i < 6; i++) {
            fail(context);
        }

        assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void shouldSpreadDelaysWithJitter() {
        ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(RetryConfig.builder()
                .baseDelay(Duration.ofSeconds(2))
                .jitterFraction(0.25)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");
        fail(context);

        for (int i = 0; i < 50; i++) {
            assertThat(strategy.nextDecision(context).delay().toMillis()).isBetween(1500L, 2500L);
        }
    }

    @Test
    void shouldNeverReportMoreAttemptsThanConfigured() {
        ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(RetryConfig.builder()
                .maxAttempts(1)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");
        fail(context);

        assertThat(strategy.nextDecision(context).retry()).isFalse();
    }
}
