package com.ytarchive.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Records terminal failures. Every report is appended to the sink, kept in a bounded in-memory
 * history and logged. Reporting never throws; a broken sink only costs the persisted copy.
 */
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    static final int MAX_HISTORY = 100;
    private static final int MAX_SUGGESTIONS = 5;
    private static final int SUMMARY_RECENT = 10;
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final ErrorReportSink sink;
    private final Clock clock;
    private final Deque<ErrorReport> history = new ArrayDeque<>();

    public ErrorReporter(ErrorReportSink sink) {
        this(sink, Clock.systemUTC());
    }

    public ErrorReporter(ErrorReportSink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String report(ErrorContext context, Exception exception) {
        RetryReason reason = context.lastReason() != null ? context.lastReason() : RetryReason.UNKNOWN;
        return report(context, exception, reason, severityFor(reason), List.of());
    }

    /**
     * @return the id of the new report, or {@code null} if not even the report could be built
     */
    public String report(ErrorContext context, Exception exception, RetryReason reason, ErrorSeverity severity,
            List<String> suggestions) {
        try {
            ErrorReport report = buildReport(context, exception, reason, severity, suggestions);
            remember(report);
            persist(report);
            logReport(report);
            return report.id();
        } catch (RuntimeException unexpected) {
            log.warn("Failed to build error report for {}", context, unexpected);
            return null;
        }
    }

    public List<ErrorReport> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * Counts by severity and the latest reports among those raised within {@code window}.
     */
    public ErrorSummary summary(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<ErrorReport> recent = new ArrayList<>();
        for (ErrorReport report : history()) {
            if (report.timestamp().isAfter(cutoff)) {
                recent.add(report);
            }
        }
        Map<ErrorSeverity, Integer> bySeverity = new EnumMap<>(ErrorSeverity.class);
        for (ErrorSeverity severity : ErrorSeverity.values()) {
            bySeverity.put(severity, 0);
        }
        for (ErrorReport report : recent) {
            bySeverity.merge(report.severity(), 1, Integer::sum);
        }
        List<ErrorReport> latest = recent.subList(Math.max(0, recent.size() - SUMMARY_RECENT), recent.size());
        return new ErrorSummary(window, recent.size(), Map.copyOf(bySeverity), List.copyOf(latest));
    }

    public static ErrorSeverity severityFor(RetryReason reason) {
        if (reason == null) {
            return ErrorSeverity.MEDIUM;
        }
        return switch (reason) {
            case RESOURCE_UNAVAILABLE, QUOTA_EXCEEDED -> ErrorSeverity.HIGH;
            case RATE_LIMIT -> ErrorSeverity.LOW;
            case NETWORK, VALIDATION, UNKNOWN -> ErrorSeverity.MEDIUM;
        };
    }

    private ErrorReport buildReport(ErrorContext context, Exception exception, RetryReason reason,
            ErrorSeverity severity, List<String> suggestions) {
        Instant now = clock.instant();
        String message = exception.getMessage() != null ? exception.getMessage() : "";
        String exceptionType = exception.getClass().getSimpleName();
        String title = exceptionType + ": " + (message.length() > 100 ? message.substring(0, 100) : message);
        boolean recoveryPossible = reason != RetryReason.RESOURCE_UNAVAILABLE && reason != RetryReason.VALIDATION;
        boolean retryRecommended = recoveryPossible && reason != null && reason.isRetryableByDefault();
        List<String> actions = suggestions == null || suggestions.isEmpty()
                ? defaultSuggestions(exception)
                : suggestions;
        return new ErrorReport(newId(now), now, severity, title, context.operationName(), context.resourceId(),
                context.traceId(), context.jobId(), reason, exception.getClass().getName(), message,
                context.attempts(), List.copyOf(actions.subList(0, Math.min(MAX_SUGGESTIONS, actions.size()))),
                recoveryPossible, retryRecommended);
    }

    private void remember(ErrorReport report) {
        synchronized (history) {
            history.addLast(report);
            while (history.size() > MAX_HISTORY) {
                history.removeFirst();
            }
        }
    }

    private void persist(ErrorReport report) {
        try {
            sink.append(report);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist error report {}: {}", report.id(), e.getMessage());
        }
    }

    private void logReport(ErrorReport report) {
        if (report.severity() == ErrorSeverity.CRITICAL || report.severity() == ErrorSeverity.HIGH) {
            log.error("[{}] {} ({} on {}, {} attempts, report {})", report.severity(), report.title(),
                    report.operation(), report.resourceId(), report.attempts().size(), report.id());
        } else {
            log.warn("[{}] {} ({} on {}, {} attempts, report {})", report.severity(), report.title(),
                    report.operation(), report.resourceId(), report.attempts().size(), report.id());
        }
    }

    private static String newId(Instant now) {
        return String.format(Locale.ROOT, "ERR_%s_%04x", ID_FORMAT.format(now),
                ThreadLocalRandom.current().nextInt(0x10000));
    }

    static List<String> defaultSuggestions(Exception exception) {
        String text = String.valueOf(exception.getMessage()).toLowerCase(Locale.ROOT);
        List<String> suggestions = new ArrayList<>();
        if (text.contains("network") || text.contains("connection")) {
            suggestions.add("Check internet connection");
            suggestions.add("Verify proxy settings if using a proxy");
            suggestions.add("Try again in a few minutes");
        }
        if (text.contains("timeout")) {
            suggestions.add("Increase timeout settings");
            suggestions.add("Check network stability");
        }
        if (text.contains("permission") || text.contains("access")) {
            suggestions.add("Check file/directory permissions");
            suggestions.add("Verify path exists and is accessible");
        }
        if (suggestions.isEmpty()) {
            if (exception instanceof IllegalArgumentException) {
                suggestions.add("Check input parameters and data format");
                suggestions.add("Verify configuration settings");
            } else {
                suggestions.add("Review error details and logs");
                suggestions.add("Try the operation again");
                suggestions.add("Check system resources and configuration");
            }
        }
        return suggestions;
    }

    public record ErrorSummary(
            Duration window,
            int totalErrors,
            Map<ErrorSeverity, Integer> bySeverity,
            List<ErrorReport> recentReports) {
    }
}
