package com.ytarchive;

import com.ytarchive.recovery.RetryReason;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * An item that could not be archived, kept for a later retry run.
 */
public record RecoveryPlanEntry(
        String itemId,
        UUID jobId,
        PlanEntryKind kind,
        RetryReason reason,
        ErrorCode errorCode,
        String message,
        int attempts,
        OffsetDateTime firstDetectedAt,
        OffsetDateTime lastAttemptAt,
        OffsetDateTime retryAfter) {

    /**
     * Folds a newer failure of the same item into this entry, keeping the first detection time and
     * adding up attempts.
     */
    public RecoveryPlanEntry mergeWith(RecoveryPlanEntry newer) {
        if (!itemId.equals(newer.itemId())) {
            throw new IllegalArgumentException("Cannot merge entries of " + itemId + " and " + newer.itemId());
        }
        OffsetDateTime first = firstDetectedAt == null || (newer.firstDetectedAt() != null
                && newer.firstDetectedAt().isBefore(firstDetectedAt)) ? newer.firstDetectedAt() : firstDetectedAt;
        return new RecoveryPlanEntry(itemId, newer.jobId(), newer.kind(), newer.reason(), newer.errorCode(),
                newer.message(), attempts + newer.attempts(), first, newer.lastAttemptAt(), newer.retryAfter());
    }
}
