package com.ytarchive.recovery;

import java.util.List;

/**
 * Collaborator-specific error handling. One implementation exists per downstream service
 * (metadata fetch, download, storage).
 */
public interface ServiceErrorHandler extends ErrorClassifier {

    /**
     * Name of the collaborator this handler covers.
     */
    String serviceName();

    /**
     * Gives the collaborator a chance to fully own a failure.
     *
     * @return {@code true} when the handler took care of the error and the generic retry loop must
     *         stop; {@code false} to fall through to classification and the retry strategy
     */
    boolean handleError(Exception exception, ErrorContext context);

    List<String> getRecoverySuggestions(ErrorContext context);
}
