package com.ytarchive.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytarchive.recovery.ErrorReport;
import com.ytarchive.recovery.ErrorReportSink;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Appends reports as JSON lines to one file per UTC day, named {@code yyyy-MM-dd.log}.
 */
public class JsonLinesErrorReportSink implements ErrorReportSink {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesErrorReportSink(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(ErrorReport report) throws IOException {
        Files.createDirectories(directory);
        String line = objectMapper.writeValueAsString(report) + System.lineSeparator();
        Files.writeString(fileFor(report), line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
    }

    public Path fileFor(ErrorReport report) {
        return directory.resolve(DAY.format(report.timestamp()) + ".log");
    }
}
