package com.ytarchive.recovery;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of an active {@link RecoveryOperation}.
 */
public record RecoverySnapshot(
        UUID id,
        String operationName,
        String resourceId,
        String traceId,
        UUID jobId,
        String strategyName,
        RecoveryStatus status,
        int attempts,
        Instant startedAt) {
}
