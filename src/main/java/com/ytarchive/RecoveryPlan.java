package com.ytarchive;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Snapshot of every item waiting for a manual or scheduled retry.
 */
public record RecoveryPlan(
        OffsetDateTime generatedAt,
        List<RecoveryPlanEntry> unavailable,
        List<RecoveryPlanEntry> failed) {

    public static RecoveryPlan of(List<RecoveryPlanEntry> entries, OffsetDateTime generatedAt) {
        List<RecoveryPlanEntry> unavailable = new ArrayList<>();
        List<RecoveryPlanEntry> failed = new ArrayList<>();
        for (RecoveryPlanEntry entry : entries) {
            if (entry.kind() == PlanEntryKind.UNAVAILABLE) {
                unavailable.add(entry);
            } else {
                failed.add(entry);
            }
        }
        Comparator<RecoveryPlanEntry> byItem = Comparator.comparing(RecoveryPlanEntry::itemId);
        unavailable.sort(byItem);
        failed.sort(byItem);
        return new RecoveryPlan(generatedAt, List.copyOf(unavailable), List.copyOf(failed));
    }

    public int unavailableCount() {
        return unavailable.size();
    }

    public int failedCount() {
        return failed.size();
    }

    public int totalCount() {
        return unavailable.size() + failed.size();
    }
}
