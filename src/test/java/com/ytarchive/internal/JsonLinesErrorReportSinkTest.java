package com.ytarchive.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytarchive.YtArchiveAutoConfiguration;
import com.ytarchive.recovery.ErrorReport;
import com.ytarchive.recovery.ErrorSeverity;
import com.ytarchive.recovery.RetryReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonLinesErrorReportSinkTest {

    @TempDir
    Path tempDir;

    private static ErrorReport report(String id, Instant timestamp) {
        return new ErrorReport(id, timestamp, ErrorSeverity.HIGH, "IOException: Video unavailable",
                "download_video", "dQw4w9WgXcQ", "trace-1", null, RetryReason.RESOURCE_UNAVAILABLE,
                "java.io.IOException", "Video unavailable", List.of(), List.of("Verify the video URL"), false,
                false);
    }

    @Test
    void shouldAppendOneLinePerReportIntoDailyFile() throws Exception {
        ObjectMapper objectMapper = new YtArchiveAutoConfiguration().ytarchiveObjectMapper();
        JsonLinesErrorReportSink sink = new JsonLinesErrorReportSink(tempDir.resolve("logs/error_reports"),
                objectMapper);

        sink.append(report("ERR_1", Instant.parse("2026-05-01T23:59:00Z")));
        sink.append(report("ERR_2", Instant.parse("2026-05-01T23:59:30Z")));
        sink.append(report("ERR_3", Instant.parse("2026-05-02T00:00:10Z")));

        Path firstDay = tempDir.resolve("logs/error_reports/2026-05-01.log");
        List<String> lines = Files.readAllLines(firstDay);
        assertEquals(2, lines.size());
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("ERR_1", first.get("id").asText());
        assertEquals("HIGH", first.get("severity").asText());
        assertEquals("2026-05-01T23:59:00Z", first.get("timestamp").asText());
        assertEquals(1, Files.readAllLines(tempDir.resolve("logs/error_reports/2026-05-02.log")).size());
    }
}
