package com.ytarchive.recovery.handler;

import com.ytarchive.recovery.CollaboratorException;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryReason;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MetadataErrorHandlerTest {

    private final MetadataErrorHandler handler = new MetadataErrorHandler();

    @Test
    void shouldTreatMalformedIdsAsValidation() {
        assertEquals(RetryReason.VALIDATION, handler.classify(new IOException("Invalid video ID: xyz")));
        assertEquals(RetryReason.VALIDATION, handler.classify(new IOException("Invalid playlist ID")));
    }

    @Test
    void shouldClassifyApiResponses() {
        assertEquals(RetryReason.QUOTA_EXCEEDED,
                handler.classify(new CollaboratorException("metadata", 403, "quotaExceeded")));
        assertEquals(RetryReason.RESOURCE_UNAVAILABLE,
                handler.classify(new CollaboratorException("metadata", 404, "videoNotFound")));
        assertEquals(RetryReason.NETWORK, handler.classify(new IOException("stream closed")));
    }

    @Test
    void shouldNeverTakeOver() {
        assertFalse(handler.handleError(new IOException("No space left on device"),
                ErrorContext.of("fetch_video_metadata", "abc")));
    }

    @Test
    void shouldSuggestByReason() {
        ErrorContext context = ErrorContext.of("fetch_video_metadata", "abc");
        context.recordFailure(Instant.now(), Duration.ZERO, new IOException("quota"), RetryReason.QUOTA_EXCEEDED,
                null);

        assertThat(handler.getRecoverySuggestions(context)).contains("Wait for the daily API quota to reset");
        assertThat(handler.getRecoverySuggestions(ErrorContext.of("fetch_video_metadata", "abc")))
                .contains("Retry the operation");
    }
}
