package com.ytarchive.internal;

import com.ytarchive.JobRepository;
import com.ytarchive.JobStatus;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.ErrorRecoveryManager;
import com.ytarchive.recovery.ErrorReporter;
import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.strategy.StrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class YtArchiveMetricsTest {

    private JobRepository jobRepository;
    private ErrorRecoveryManager recoveryManager;
    private MeterRegistry meterRegistry;
    private YtArchiveMetrics metrics;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        recoveryManager = new ErrorRecoveryManager(new ErrorReporter(report -> {
        }));
        meterRegistry = new SimpleMeterRegistry();
        metrics = new YtArchiveMetrics(jobRepository, recoveryManager, meterRegistry);
    }

    @Test
    void shouldRegisterGaugesForJobStatuses() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        counts.put(JobStatus.RUNNING, 2L);
        counts.put(JobStatus.COMPLETED, 40L);
        counts.put(JobStatus.FAILED, 3L);
        when(jobRepository.countByStatus()).thenReturn(counts);

        metrics.registerMetrics();

        Gauge running = meterRegistry.find("ytarchive.jobs.count").tag("status", "RUNNING").gauge();
        assertThat(running).isNotNull();
        assertThat(running.value()).isEqualTo(2.0);

        Gauge cancelled = meterRegistry.find("ytarchive.jobs.count").tag("status", "CANCELLED").gauge();
        assertThat(cancelled).isNotNull();
        assertThat(cancelled.value()).isEqualTo(0.0);

        Gauge total = meterRegistry.find("ytarchive.jobs.total").gauge();
        assertThat(total).isNotNull();
        assertThat(total.value()).isEqualTo(45.0);

        Gauge active = meterRegistry.find("ytarchive.recoveries.active").gauge();
        assertThat(active).isNotNull();
        assertThat(active.value()).isEqualTo(0.0);

        verify(jobRepository, times(1)).countByStatus();
    }

    @Test
    void shouldReportZeroWhenCountingFails() {
        when(jobRepository.countByStatus()).thenThrow(new IllegalStateException("unavailable"));

        metrics.registerMetrics();

        assertThat(meterRegistry.find("ytarchive.jobs.total").gauge().value()).isEqualTo(0.0);
    }

    @Test
    void shouldCountRecoveryOutcomes() {
        metrics.registerMetrics();
        RetryConfig config = RetryConfig.builder().maxAttempts(1).build();

        recoveryManager.executeWithRetry(() -> "ok", ErrorContext.of("fetch_metadata", "dQw4w9WgXcQ"),
                recoveryManager.strategies().create(StrategyType.FIXED_DELAY, config));
        recoveryManager.executeWithRetry(() -> {
            throw new IOException("Video unavailable");
        }, ErrorContext.of("fetch_metadata", "abcdefghijk"),
                recoveryManager.strategies().create(StrategyType.FIXED_DELAY, config));

        Counter succeeded = meterRegistry.find("ytarchive.recoveries.outcome").tag("outcome", "SUCCEEDED").counter();
        Counter nonRetryable = meterRegistry.find("ytarchive.recoveries.outcome").tag("outcome", "NON_RETRYABLE")
                .counter();
        assertThat(succeeded).isNotNull();
        assertThat(succeeded.count()).isEqualTo(1.0);
        assertThat(nonRetryable).isNotNull();
        assertThat(nonRetryable.count()).isEqualTo(1.0);
    }
}
