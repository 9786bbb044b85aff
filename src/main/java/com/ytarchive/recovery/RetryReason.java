package com.ytarchive.recovery;

/**
 * Category of a failed attempt, derived per attempt by an {@link ErrorClassifier}.
 */
public enum RetryReason {

    /**
     * Timeouts, connection resets, 5xx responses.
     */
    NETWORK(true),

    /**
     * HTTP 429 and soft quota warnings. Retried with backoff, honouring any retry-after hint.
     */
    RATE_LIMIT(true),

    /**
     * Hard daily quota hit. Retried only when the quota reset fits inside the retry budget.
     */
    QUOTA_EXCEEDED(true),

    /**
     * Private, deleted or region-blocked content. Goes straight to the recovery plan.
     */
    RESOURCE_UNAVAILABLE(false),

    /**
     * Malformed input. Fatal to the operation, not to the process.
     */
    VALIDATION(false),

    UNKNOWN(true);

    private final boolean retryableByDefault;

    RetryReason(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
