package com.ytarchive.recovery;

import java.time.Duration;

/**
 * Failure reported by a downstream collaborator (metadata, download or storage service). Carries
 * the HTTP status when the collaborator answered one and an optional retry-after hint.
 */
public class CollaboratorException extends Exception {

    private final String service;
    private final int statusCode;
    private final Duration retryAfter;

    public CollaboratorException(String service, String message) {
        this(service, 0, message, null, null);
    }

    public CollaboratorException(String service, int statusCode, String message) {
        this(service, statusCode, message, null, null);
    }

    public CollaboratorException(String service, int statusCode, String message, Duration retryAfter) {
        this(service, statusCode, message, retryAfter, null);
    }

    public CollaboratorException(String service, int statusCode, String message, Duration retryAfter,
            Throwable cause) {
        super(message, cause);
        this.service = service;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public String getService() {
        return service;
    }

    /**
     * HTTP status returned by the collaborator, or {@code 0} when the call never got an answer.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
