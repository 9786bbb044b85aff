package com.ytarchive.recovery;

/**
 * Raised when a recovery sequence is aborted by its {@link CancellationToken} or by thread
 * interruption.
 */
public class RecoveryCancelledException extends RuntimeException {

    public RecoveryCancelledException(String message) {
        super(message);
    }

    public RecoveryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
