package com.ytarchive.recovery;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Structured record of a terminal failure, written by {@link ErrorReporter}.
 */
public record ErrorReport(
        String id,
        Instant timestamp,
        ErrorSeverity severity,
        String title,
        String operation,
        String resourceId,
        String traceId,
        UUID jobId,
        RetryReason reason,
        String exceptionType,
        String message,
        List<AttemptRecord> attempts,
        List<String> suggestedActions,
        boolean recoveryPossible,
        boolean retryRecommended) {
}
