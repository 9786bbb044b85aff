package com.ytarchive.recovery;

/**
 * Lifecycle of a {@link RecoveryOperation}. Everything except ACTIVE is terminal.
 */
public enum RecoveryStatus {
    ACTIVE,
    SUCCEEDED,
    FAILED_RETRYABLE_EXHAUSTED,
    FAILED_NONRETRYABLE,
    CANCELLED
}
