package com.ytarchive;

import com.ytarchive.recovery.RecoveryOutcome;
import com.ytarchive.recovery.RetryReason;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ErrorCodeTest {

    @Test
    void shouldMapReasons() {
        assertEquals(ErrorCode.E001, ErrorCode.from(RecoveryOutcome.EXHAUSTED, RetryReason.QUOTA_EXCEEDED, "metadata"));
        assertEquals(ErrorCode.E001, ErrorCode.from(RecoveryOutcome.EXHAUSTED, RetryReason.RATE_LIMIT, "download"));
        assertEquals(ErrorCode.E002,
                ErrorCode.from(RecoveryOutcome.NON_RETRYABLE, RetryReason.RESOURCE_UNAVAILABLE, "download"));
        assertEquals(ErrorCode.E003, ErrorCode.from(RecoveryOutcome.EXHAUSTED, RetryReason.NETWORK, "download"));
        assertEquals(ErrorCode.E007, ErrorCode.from(RecoveryOutcome.NON_RETRYABLE, RetryReason.VALIDATION, "storage"));
        assertEquals(ErrorCode.E999, ErrorCode.from(RecoveryOutcome.EXHAUSTED, RetryReason.UNKNOWN, "storage"));
        assertEquals(ErrorCode.E999, ErrorCode.from(RecoveryOutcome.EXHAUSTED, null, "storage"));
    }

    @Test
    void shouldMapOutcomesBeforeReasons() {
        assertEquals(ErrorCode.E008, ErrorCode.from(RecoveryOutcome.CANCELLED, RetryReason.NETWORK, "download"));
        assertEquals(ErrorCode.E006, ErrorCode.from(RecoveryOutcome.CIRCUIT_OPEN, RetryReason.NETWORK, "storage"));
        assertEquals(ErrorCode.E004, ErrorCode.from(RecoveryOutcome.HANDLED, RetryReason.NETWORK, "storage"));
        assertEquals(ErrorCode.E006, ErrorCode.from(RecoveryOutcome.HANDLED, RetryReason.NETWORK, "metadata"));
    }
}
