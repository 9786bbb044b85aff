package com.ytarchive.recovery;

import java.io.IOException;

/**
 * Append-only destination for {@link ErrorReport}s.
 */
@FunctionalInterface
public interface ErrorReportSink {

    void append(ErrorReport report) throws IOException;
}
