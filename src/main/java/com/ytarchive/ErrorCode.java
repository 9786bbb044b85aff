package com.ytarchive;

import com.ytarchive.recovery.RecoveryOutcome;
import com.ytarchive.recovery.RetryReason;

/**
 * User-facing error codes carried by item results and recovery plan entries.
 */
public enum ErrorCode {
    E001("API quota exceeded"),
    E002("Video unavailable"),
    E003("Network error"),
    E004("Storage full"),
    E005("Invalid credentials"),
    E006("Service unavailable"),
    E007("Invalid request"),
    E008("Cancelled"),
    E999("Internal error");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static ErrorCode from(RecoveryOutcome outcome, RetryReason reason, String service) {
        if (outcome == RecoveryOutcome.CANCELLED) {
            return E008;
        }
        if (outcome == RecoveryOutcome.CIRCUIT_OPEN) {
            return E006;
        }
        if (outcome == RecoveryOutcome.HANDLED) {
            // handlers only take over failures that need an operator, such as a full disk
            return "metadata".equals(service) ? E006 : E004;
        }
        if (reason == null) {
            return E999;
        }
        return switch (reason) {
            case QUOTA_EXCEEDED, RATE_LIMIT -> E001;
            case RESOURCE_UNAVAILABLE -> E002;
            case NETWORK -> E003;
            case VALIDATION -> E007;
            case UNKNOWN -> E999;
        };
    }
}
