package com.ytarchive.recovery.handler;

import com.ytarchive.recovery.DefaultErrorClassifier;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryReason;
import com.ytarchive.recovery.ServiceErrorHandler;

import java.util.List;

/**
 * Errors from the metadata service. Pure classification: metadata failures are always left to the
 * retry strategy.
 */
public class MetadataErrorHandler extends DefaultErrorClassifier implements ServiceErrorHandler {

    public static final String SERVICE_NAME = "metadata";

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public RetryReason classify(Exception exception) {
        String message = messageOf(exception);
        if (message.contains("invalid video id") || message.contains("invalid playlist id")) {
            return RetryReason.VALIDATION;
        }
        RetryReason reason = super.classify(exception);
        if (reason == RetryReason.UNKNOWN && isIoFailure(exception)) {
            return RetryReason.NETWORK;
        }
        return reason;
    }

    @Override
    public boolean handleError(Exception exception, ErrorContext context) {
        return false;
    }

    @Override
    public List<String> getRecoverySuggestions(ErrorContext context) {
        RetryReason reason = context.lastReason();
        if (reason == null) {
            return List.of("Check logs for more details", "Retry the operation");
        }
        return switch (reason) {
            case QUOTA_EXCEEDED -> List.of(
                    "Wait for the daily API quota to reset",
                    "Reduce the number of metadata requests per run");
            case RATE_LIMIT -> List.of(
                    "Lower batch concurrency",
                    "Try again in a few minutes");
            case RESOURCE_UNAVAILABLE -> List.of(
                    "Verify the video or playlist still exists and is public",
                    "Check if the content is available in your region");
            case VALIDATION -> List.of(
                    "Check the video or playlist URL format",
                    "Verify the id was copied completely");
            case NETWORK -> List.of(
                    "Check internet connectivity",
                    "Verify the metadata service is reachable");
            case UNKNOWN -> List.of("Check logs for more details", "Retry the operation");
        };
    }
}
