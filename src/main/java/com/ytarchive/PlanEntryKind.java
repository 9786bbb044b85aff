package com.ytarchive;

public enum PlanEntryKind {

    /**
     * Permanently unavailable content (private, deleted, region-blocked).
     */
    UNAVAILABLE,

    /**
     * Gave up after retrying; may succeed on a later run.
     */
    FAILED
}
