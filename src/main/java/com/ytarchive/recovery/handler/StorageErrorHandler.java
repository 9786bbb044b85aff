package com.ytarchive.recovery.handler;

import com.ytarchive.recovery.DefaultErrorClassifier;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.RetryReason;
import com.ytarchive.recovery.ServiceErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.AccessDeniedException;
import java.nio.file.ReadOnlyFileSystemException;
import java.util.List;

/**
 * Errors from the archive storage. A full or read-only disk will not heal by retrying, so those are
 * escalated; everything else I/O-shaped is treated as transient.
 */
public class StorageErrorHandler extends DefaultErrorClassifier implements ServiceErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(StorageErrorHandler.class);

    public static final String SERVICE_NAME = "storage";

    private static final List<String> DISK_FULL_KEYWORDS = List.of("no space", "enospc", "disk full");
    private static final List<String> NOT_WRITABLE_KEYWORDS = List.of("read-only", "erofs", "permission denied");

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public RetryReason classify(Exception exception) {
        RetryReason reason = super.classify(exception);
        if (reason == RetryReason.UNKNOWN && isIoFailure(exception)) {
            return RetryReason.NETWORK;
        }
        return reason;
    }

    @Override
    public boolean handleError(Exception exception, ErrorContext context) {
        String message = messageOf(exception);
        if (containsAny(message, DISK_FULL_KEYWORDS)) {
            log.error("Storage is full while writing {}", context.resourceId());
            return true;
        }
        if (isNotWritable(exception) || containsAny(message, NOT_WRITABLE_KEYWORDS)) {
            log.error("Storage is not writable while writing {}: {}", context.resourceId(), exception.getMessage());
            return true;
        }
        return false;
    }

    @Override
    public List<String> getRecoverySuggestions(ErrorContext context) {
        String message = DownloadErrorHandler.lastMessage(context);
        if (containsAny(message, DISK_FULL_KEYWORDS)) {
            return List.of(
                    "Free up disk space on the archive volume",
                    "Point the archive at a larger volume");
        }
        if (containsAny(message, NOT_WRITABLE_KEYWORDS)) {
            return List.of(
                    "Check file/directory permissions",
                    "Verify the archive volume is mounted read-write");
        }
        return List.of("Check that the archive volume is mounted", "Retry the operation");
    }

    private static boolean isNotWritable(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof AccessDeniedException || current instanceof ReadOnlyFileSystemException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
