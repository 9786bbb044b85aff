package com.ytarchive;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Outcome of one work item (a video) inside a job.
 */
public record JobResult(
        String itemId,
        ItemStatus status,
        ErrorCode errorCode,
        String message,
        int attempts,
        List<Long> retryDelaysMillis,
        String filePath,
        Long fileSize,
        OffsetDateTime startedAt,
        long durationMillis) {

    public JobResult {
        retryDelaysMillis = retryDelaysMillis == null ? List.of() : List.copyOf(retryDelaysMillis);
    }

    public static JobResult success(String itemId, int attempts, List<Long> retryDelaysMillis, String filePath,
            Long fileSize, OffsetDateTime startedAt, long durationMillis) {
        return new JobResult(itemId, ItemStatus.SUCCESS, null, null, attempts, retryDelaysMillis, filePath, fileSize,
                startedAt, durationMillis);
    }

    public static JobResult skipped(String itemId, String message, OffsetDateTime startedAt) {
        return new JobResult(itemId, ItemStatus.SKIPPED, null, message, 0, List.of(), null, null, startedAt, 0L);
    }

    public static JobResult failed(String itemId, ErrorCode errorCode, String message, int attempts,
            List<Long> retryDelaysMillis, OffsetDateTime startedAt, long durationMillis) {
        return new JobResult(itemId, ItemStatus.FAILED, errorCode, message, attempts, retryDelaysMillis, null, null,
                startedAt, durationMillis);
    }
}
