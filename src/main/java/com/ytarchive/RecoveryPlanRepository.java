package com.ytarchive;

import java.util.List;
import java.util.Optional;

public interface RecoveryPlanRepository {

    /**
     * Adds an entry, merging with an existing entry for the same item.
     */
    RecoveryPlanEntry record(RecoveryPlanEntry entry);

    List<RecoveryPlanEntry> findAll();

    Optional<RecoveryPlanEntry> findByItemId(String itemId);
}
