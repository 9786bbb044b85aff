package com.ytarchive.recovery;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classification by HTTP status, exception type and message keywords. Used directly when no
 * collaborator handler is supplied, and as the base of the collaborator handlers.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    protected static final List<String> UNAVAILABLE_KEYWORDS = List.of(
            "video unavailable", "private video", "deleted", "removed", "region", "age restricted", "copyright",
            "not found");

    protected static final List<String> NETWORK_KEYWORDS = List.of(
            "timeout", "timed out", "connection", "network", "dns", "resolve", "unreachable", "refused", "reset",
            "broken pipe", "http error", "server error", "service unavailable", "temporary failure");

    protected static final List<String> RATE_LIMIT_KEYWORDS = List.of("rate limit", "too many requests");

    @Override
    public RetryReason classify(Exception exception) {
        if (exception == null) {
            return RetryReason.UNKNOWN;
        }
        int status = statusOf(exception);
        if (status > 0) {
            RetryReason byStatus = classifyStatus(status, messageOf(exception));
            if (byStatus != null) {
                return byStatus;
            }
        }
        RetryReason byType = classifyType(exception);
        if (byType != null) {
            return byType;
        }
        RetryReason byMessage = classifyMessage(messageOf(exception));
        return byMessage != null ? byMessage : RetryReason.UNKNOWN;
    }

    protected RetryReason classifyStatus(int status, String message) {
        if (status == 429) {
            return RetryReason.RATE_LIMIT;
        }
        if (status == 403 && message.contains("quota")) {
            return RetryReason.QUOTA_EXCEEDED;
        }
        if (status == 403 || status == 404 || status == 410) {
            return RetryReason.RESOURCE_UNAVAILABLE;
        }
        if (status == 400 || status == 422) {
            return RetryReason.VALIDATION;
        }
        if (status >= 500) {
            return RetryReason.NETWORK;
        }
        return null;
    }

    protected RetryReason classifyType(Exception exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof ConnectException
                    || current instanceof UnknownHostException || current instanceof TimeoutException) {
                return RetryReason.NETWORK;
            }
            current = current.getCause();
        }
        if (exception instanceof IllegalArgumentException) {
            return RetryReason.VALIDATION;
        }
        return null;
    }

    protected RetryReason classifyMessage(String message) {
        if (containsAny(message, RATE_LIMIT_KEYWORDS)) {
            return RetryReason.RATE_LIMIT;
        }
        if (message.contains("quota")) {
            return RetryReason.QUOTA_EXCEEDED;
        }
        if (containsAny(message, UNAVAILABLE_KEYWORDS)) {
            return RetryReason.RESOURCE_UNAVAILABLE;
        }
        if (containsAny(message, NETWORK_KEYWORDS)) {
            return RetryReason.NETWORK;
        }
        return null;
    }

    /**
     * Lower-cased messages of the exception and its causes, joined by spaces.
     */
    protected static String messageOf(Throwable exception) {
        StringBuilder text = new StringBuilder();
        Throwable current = exception;
        while (current != null) {
            if (current.getMessage() != null) {
                text.append(current.getMessage().toLowerCase(Locale.ROOT)).append(' ');
            }
            current = current.getCause();
        }
        return text.toString();
    }

    protected static int statusOf(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof CollaboratorException collaboratorException
                    && collaboratorException.getStatusCode() > 0) {
                return collaboratorException.getStatusCode();
            }
            current = current.getCause();
        }
        return 0;
    }

    protected static boolean isIoFailure(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    protected static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
