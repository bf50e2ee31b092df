package com.di.insightnova.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured event logger for job runs, API operations and handled errors.
 *
 * <p>Each event is one {@code [EVENT]} log line rendered as a JSON-like object with
 * {@code eventType}, {@code timestamp}, {@code applicationId}, the correlation id taken from MDC
 * ({@code runId}, {@code jobId} or {@code requestId}), the thread, and a free-form context map.
 */
@Slf4j
@Component
public class JobEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

    private final String applicationId;

    public JobEventLogger(@Value("${spring.application.name:insightnova}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[EVENT] JobEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String correlationId, String operation) {
        logEvent(eventType, context, correlationId, operation, null);
    }

    /**
     * Logs one structured event.
     *
     * @param eventType     e.g. {@code PIPELINE_COMPLETED}, {@code INGEST_FAILED}
     * @param context       extra fields; may be null
     * @param correlationId id from MDC; {@code unknown} when null
     * @param operation     what was being done, e.g. {@code pipeline_batch}
     * @param exception     failure, summarised into {@code stackTraceSummary}
     */
    public void logEvent(String eventType, Map<String, Object> context, String correlationId,
                         String operation, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("correlationId", correlationId != null ? correlationId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> ctx = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (operation != null && !operation.isEmpty()) {
            ctx.put("operation", operation);
        }
        if (exception != null) {
            ctx.put("stackTraceSummary", getStackTraceSummary(exception, 5));
        }
        if (!ctx.isEmpty()) {
            event.put("context", ctx);
        }

        if (exception != null) {
            log.warn("[EVENT] {}", formatMap(event));
        } else {
            log.info("[EVENT] {}", formatMap(event));
        }
    }

    private String formatMap(Map<?, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append('"').append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Map) {
                sb.append(formatMap((Map<?, ?>) value));
            } else {
                sb.append('"').append(escapeJson(String.valueOf(value))).append('"');
            }
        }
        return sb.append('}').toString();
    }

    private String escapeJson(String str) {
        return str.replace("\\", "\\\\")
                  .replace("\"", "\\\"")
                  .replace("\n", "\\n")
                  .replace("\r", "\\r")
                  .replace("\t", "\\t");
    }

    private String getStackTraceSummary(Throwable exception, int maxLines) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int linesToInclude = Math.min(maxLines, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < linesToInclude; i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > maxLines) {
            summary.append(" | ... (").append(lines.length - maxLines).append(" more lines)");
        }
        return summary.toString();
    }
}
