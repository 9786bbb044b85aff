package com.ytarchive.internal;

import com.ytarchive.JobRepository;
import com.ytarchive.JobStatus;
import com.ytarchive.config.YtArchiveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Locale;

/**
 * Deletes finished jobs past their retention. Recovery plan entries are kept.
 */
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobRepository jobRepository;
    private final YtArchiveProperties properties;
    private final Clock clock;

    public JobCleaner(JobRepository jobRepository, YtArchiveProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.clock = clock;
    }

    // Run cleaner every hour
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        log.info("Running job retention cleanup...");

        try {
            String successRetentionStr = properties.getBackgroundJobServer().getDeleteSucceededJobsAfter();
            if (successRetentionStr != null && !successRetentionStr.isEmpty()) {
                Duration retention = parseDuration(successRetentionStr);
                OffsetDateTime threshold = OffsetDateTime.now(clock).minus(retention);
                int deleted = jobRepository.deleteTerminalBefore(EnumSet.of(JobStatus.COMPLETED), threshold);
                if (deleted > 0) {
                    log.info("Cleaned up {} completed jobs older than {}", deleted, retention);
                }
            }
        } catch (Exception e) {
            log.error("Failed to clean up completed jobs: {}", e.getMessage());
        }

        try {
            String failedRetentionStr = properties.getBackgroundJobServer().getDeleteFailedJobsAfter();
            if (failedRetentionStr != null && !failedRetentionStr.isEmpty()) {
                Duration retention = parseDuration(failedRetentionStr);
                OffsetDateTime threshold = OffsetDateTime.now(clock).minus(retention);
                int deleted = jobRepository.deleteTerminalBefore(EnumSet.of(JobStatus.FAILED, JobStatus.CANCELLED),
                        threshold);
                if (deleted > 0) {
                    log.info("Deleted {} failed or cancelled jobs older than {}", deleted, retention);
                }
            }
        } catch (Exception e) {
            log.error("Failed to clean up failed jobs: {}", e.getMessage());
        }
    }

    static Duration parseDuration(String durationStr) {
        String trimmed = durationStr.trim();
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException ignored) {
            // Continue with shorthand parsing below.
        }

        // Supports shorthand inputs like "90m", "36h" or "7d".
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        if (shorthand.endsWith("m")) {
            return Duration.ofMinutes(amount);
        } else if (shorthand.endsWith("h")) {
            return Duration.ofHours(amount);
        } else if (shorthand.endsWith("d")) {
            return Duration.ofDays(amount);
        }
        throw new IllegalArgumentException("Unsupported duration value: " + durationStr);
    }
}
