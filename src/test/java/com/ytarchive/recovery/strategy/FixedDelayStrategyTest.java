package com.ytarchive.recovery.strategy;

import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.RetryDecision;
import com.ytarchive.recovery.RetryReason;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class FixedDelayStrategyTest {

    private static void fail(ErrorContext context, RetryReason reason, Duration retryAfter) {
        context.recordFailure(Instant.now(), Duration.ofMillis(5), new IOException("boom"), reason, retryAfter);
    }

    @Test
    void shouldWaitBaseDelayWithinJitter() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder()
                .baseDelay(Duration.ofSeconds(1))
                .jitterFraction(0.1)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");
        fail(context, RetryReason.NETWORK, null);

        for (int i = 0; i < 50; i++) {
            RetryDecision decision = strategy.nextDecision(context);
            assertThat(decision.retry()).isTrue();
            assertThat(decision.delay().toMillis()).isBetween(900L, 1100L);
        }
    }

    @Test
    void shouldKeepDelayConstantAcrossAttempts() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder()
                .maxAttempts(5)
                .baseDelay(Duration.ofMillis(200))
                .jitterFraction(0)
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");

        for (int i = 0; i < 4; i++) {
            fail(context, RetryReason.NETWORK, null);
            assertThat(strategy.nextDecision(context).delay()).isEqualTo(Duration.ofMillis(200));
        }
    }

    @Test
    void shouldStopOnceMaxAttemptsReached() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder().maxAttempts(3).build());
        ErrorContext context = ErrorContext.of("download_video", "abc");

        fail(context, RetryReason.NETWORK, null);
        fail(context, RetryReason.NETWORK, null);
        assertThat(strategy.nextDecision(context).retry()).isTrue();

        fail(context, RetryReason.NETWORK, null);
        assertThat(strategy.nextDecision(context)).isEqualTo(RetryDecision.stop());
    }

    @Test
    void shouldNotRetryNonRetryableReasons() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.defaults());

        ErrorContext unavailable = ErrorContext.of("download_video", "abc");
        fail(unavailable, RetryReason.RESOURCE_UNAVAILABLE, null);
        assertThat(strategy.nextDecision(unavailable).retry()).isFalse();

        ErrorContext invalid = ErrorContext.of("download_video", "def");
        fail(invalid, RetryReason.VALIDATION, null);
        assertThat(strategy.nextDecision(invalid).retry()).isFalse();
    }

    @Test
    void shouldHonourRateLimitHintUpToMaxDelay() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofMinutes(1))
                .jitterFraction(0)
                .build());

        ErrorContext hinted = ErrorContext.of("fetch_video_metadata", "abc");
        fail(hinted, RetryReason.RATE_LIMIT, Duration.ofSeconds(30));
        assertThat(strategy.nextDecision(hinted).delay()).isEqualTo(Duration.ofSeconds(30));

        ErrorContext overlong = ErrorContext.of("fetch_video_metadata", "def");
        fail(overlong, RetryReason.RATE_LIMIT, Duration.ofHours(1));
        RetryDecision capped = strategy.nextDecision(overlong);
        assertThat(capped.retry()).isTrue();
        assertThat(capped.delay()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void shouldRetryQuotaOnlyWhenResetFitsTheBudget() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofMinutes(5))
                .jitterFraction(0)
                .build());

        ErrorContext noHint = ErrorContext.of("fetch_video_metadata", "a");
        fail(noHint, RetryReason.QUOTA_EXCEEDED, null);
        assertThat(strategy.nextDecision(noHint).retry()).isFalse();

        ErrorContext soon = ErrorContext.of("fetch_video_metadata", "b");
        fail(soon, RetryReason.QUOTA_EXCEEDED, Duration.ofMinutes(2));
        RetryDecision decision = strategy.nextDecision(soon);
        assertThat(decision.retry()).isTrue();
        assertThat(decision.delay()).isEqualTo(Duration.ofMinutes(2));

        ErrorContext tomorrow = ErrorContext.of("fetch_video_metadata", "c");
        fail(tomorrow, RetryReason.QUOTA_EXCEEDED, Duration.ofHours(20));
        assertThat(strategy.nextDecision(tomorrow).retry()).isFalse();
    }

    @Test
    void shouldOnlyRetryConfiguredReasons() {
        FixedDelayStrategy strategy = new FixedDelayStrategy(RetryConfig.builder()
                .retryableReasons(EnumSet.of(RetryReason.NETWORK))
                .build());
        ErrorContext context = ErrorContext.of("download_video", "abc");
        fail(context, RetryReason.UNKNOWN, null);

        assertThat(strategy.nextDecision(context).retry()).isFalse();
    }
}
