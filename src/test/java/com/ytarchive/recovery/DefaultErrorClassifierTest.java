package com.ytarchive.recovery;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DefaultErrorClassifierTest {

    private final DefaultErrorClassifier classifier = new DefaultErrorClassifier();

    @Test
    void shouldClassifyByStatusFirst() {
        assertEquals(RetryReason.RATE_LIMIT, classifier.classify(new CollaboratorException("api", 429, "slow down")));
        assertEquals(RetryReason.QUOTA_EXCEEDED,
                classifier.classify(new CollaboratorException("api", 403, "Daily quota exceeded")));
        assertEquals(RetryReason.RESOURCE_UNAVAILABLE,
                classifier.classify(new CollaboratorException("api", 403, "Forbidden")));
        assertEquals(RetryReason.RESOURCE_UNAVAILABLE,
                classifier.classify(new CollaboratorException("api", 410, "Gone")));
        assertEquals(RetryReason.VALIDATION, classifier.classify(new CollaboratorException("api", 400, "Bad id")));
        assertEquals(RetryReason.NETWORK, classifier.classify(new CollaboratorException("api", 502, "Bad gateway")));
    }

    @Test
    void shouldClassifyNetworkExceptionsInCauseChain() {
        assertEquals(RetryReason.NETWORK, classifier.classify(new SocketTimeoutException()));
        assertEquals(RetryReason.NETWORK, classifier.classify(new ConnectException()));
        assertEquals(RetryReason.NETWORK,
                classifier.classify(new IOException("wrapped", new UnknownHostException("youtube.com"))));
    }

    @Test
    void shouldClassifyByMessageKeywords() {
        assertEquals(RetryReason.RATE_LIMIT, classifier.classify(new IOException("HTTP Error: Too Many Requests")));
        assertEquals(RetryReason.QUOTA_EXCEEDED, classifier.classify(new IOException("quotaExceeded")));
        assertEquals(RetryReason.RESOURCE_UNAVAILABLE,
                classifier.classify(new IOException("This is a Private Video")));
        assertEquals(RetryReason.NETWORK, classifier.classify(new IOException("Connection reset by peer")));
    }

    @Test
    void shouldTreatIllegalArgumentAsValidation() {
        assertEquals(RetryReason.VALIDATION, classifier.classify(new IllegalArgumentException("bad")));
    }

    @Test
    void shouldFallBackToUnknown() {
        assertEquals(RetryReason.UNKNOWN, classifier.classify(new IllegalStateException("odd")));
        assertEquals(RetryReason.UNKNOWN, classifier.classify(null));
    }

    @Test
    void shouldReadRetryAfterFromCauseChain() {
        Exception wrapped = new IOException("wrapped",
                new CollaboratorException("api", 429, "slow", Duration.ofSeconds(30)));

        assertEquals(Duration.ofSeconds(30), classifier.retryAfter(wrapped));
        assertNull(classifier.retryAfter(new IOException("no hint")));
    }
}
