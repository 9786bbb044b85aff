package com.ytarchive.internal;

import com.ytarchive.JobRepository;
import com.ytarchive.JobStatus;
import com.ytarchive.recovery.ErrorRecoveryManager;
import com.ytarchive.recovery.RecoveryOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class YtArchiveMetrics {

    private static final Logger log = LoggerFactory.getLogger(YtArchiveMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final ErrorRecoveryManager recoveryManager;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();
    private final Map<RecoveryOutcome, Counter> outcomeCounters = new EnumMap<>(RecoveryOutcome.class);

    private volatile Map<JobStatus, Long> cachedCounts = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean hasSnapshot = false;

    public YtArchiveMetrics(JobRepository jobRepository, ErrorRecoveryManager recoveryManager,
            MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.recoveryManager = recoveryManager;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering ytarchive meters...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("ytarchive.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of archive jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder("ytarchive.jobs.total", this, YtArchiveMetrics::totalCount)
                .description("Total number of archive jobs in the repository")
                .register(meterRegistry);

        Gauge.builder("ytarchive.recoveries.active", recoveryManager, ErrorRecoveryManager::getActiveRecoveryCount)
                .description("Retry sequences currently in flight")
                .register(meterRegistry);

        for (RecoveryOutcome outcome : RecoveryOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("ytarchive.recoveries.outcome")
                    .description("Finished retry sequences by outcome")
                    .tag("outcome", outcome.name())
                    .register(meterRegistry));
        }
        recoveryManager.addOutcomeListener(outcome -> outcomeCounters.get(outcome).increment());
    }

    private double countFor(JobStatus status) {
        return getSnapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        long total = 0;
        for (long count : getSnapshot().values()) {
            total += count;
        }
        return total;
    }

    private Map<JobStatus, Long> getSnapshot() {
        long now = System.nanoTime();
        if (hasSnapshot && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedCounts;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (hasSnapshot && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedCounts;
            }
            cachedCounts = loadSnapshot();
            snapshotCapturedAtNanos = now;
            hasSnapshot = true;
            return cachedCounts;
        }
    }

    private Map<JobStatus, Long> loadSnapshot() {
        try {
            return Map.copyOf(jobRepository.countByStatus());
        } catch (Exception e) {
            log.trace("Failed to count jobs by status for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
