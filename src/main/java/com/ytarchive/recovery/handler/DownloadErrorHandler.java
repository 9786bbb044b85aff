package com.ytarchive.recovery.handler;

import com.ytarchive.recovery.DefaultErrorClassifier;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryReason;
import com.ytarchive.recovery.ServiceErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Errors from the video downloader. Permanent YouTube errors are never retried; running out of disk
 * space is escalated instead of retried.
 */
public class DownloadErrorHandler extends DefaultErrorClassifier implements ServiceErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(DownloadErrorHandler.class);

    public static final String SERVICE_NAME = "download";

    static final List<String> YOUTUBE_PERMANENT_KEYWORDS = List.of(
            "video unavailable", "private video", "deleted", "removed", "region", "age restricted", "copyright");

    static final List<String> FILESYSTEM_KEYWORDS = List.of(
            "permission denied", "disk full", "no space", "read-only", "file exists", "directory not found");

    static final List<String> DISK_SPACE_KEYWORDS = List.of("no space left", "disk full", "enospc");

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public RetryReason classify(Exception exception) {
        String message = messageOf(exception);
        if (containsAny(message, YOUTUBE_PERMANENT_KEYWORDS)) {
            return RetryReason.RESOURCE_UNAVAILABLE;
        }
        if (containsAny(message, RATE_LIMIT_KEYWORDS) || statusOf(exception) == 429) {
            return RetryReason.RATE_LIMIT;
        }
        if (message.contains("permission denied") || message.contains("read-only")) {
            return RetryReason.VALIDATION;
        }
        RetryReason reason = super.classify(exception);
        if (reason == RetryReason.UNKNOWN && isIoFailure(exception) && !containsAny(message, FILESYSTEM_KEYWORDS)) {
            return RetryReason.NETWORK;
        }
        return reason;
    }

    @Override
    public boolean handleError(Exception exception, ErrorContext context) {
        if (containsAny(messageOf(exception), DISK_SPACE_KEYWORDS)) {
            log.error("Download of {} stopped: out of disk space", context.resourceId());
            return true;
        }
        return false;
    }

    @Override
    public List<String> getRecoverySuggestions(ErrorContext context) {
        String message = lastMessage(context);
        if (containsAny(message, DISK_SPACE_KEYWORDS)) {
            return List.of(
                    "Check available disk space in output directory",
                    "Consider cleaning up old downloads",
                    "Move downloads to a different location with more space");
        }
        if (containsAny(message, NETWORK_KEYWORDS)) {
            return List.of(
                    "Check internet connectivity",
                    "Try a different network connection",
                    "Verify YouTube is accessible from your location");
        }
        if (containsAny(message, YOUTUBE_PERMANENT_KEYWORDS)) {
            return List.of(
                    "Verify the video URL is correct and accessible",
                    "Check if the video is available in your region",
                    "Try accessing the video in a web browser");
        }
        return List.of("Check logs for more details", "Retry the operation");
    }

    static String lastMessage(ErrorContext context) {
        if (context.lastAttempt() == null || context.lastAttempt().message() == null) {
            return "";
        }
        return context.lastAttempt().message().toLowerCase(Locale.ROOT);
    }
}
