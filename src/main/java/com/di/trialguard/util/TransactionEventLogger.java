package com.di.trialguard.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured transaction event logger.
 *
 * <p>Each event is one {@code [TX] EVENT:} log line holding a JSON object with the event type, an ISO-8601
 * timestamp, the application id, the transaction id (from MDC, or {@code unknown}), the thread and a context map.
 * Failed events carry a short stack trace summary.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final int STACK_TRACE_LINES = 5;

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();

    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         Thread thread, String transactionContext, String applicationId) {
        logEvent(eventType, context, transactionId, thread, transactionContext, applicationId, null);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         Thread thread, String transactionContext, String applicationId, Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> eventContext = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (transactionContext != null && !transactionContext.isEmpty()) {
            eventContext.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            eventContext.put("stackTraceSummary", stackTraceSummary(exception));
        }
        if (!eventContext.isEmpty()) {
            event.put("context", eventContext);
        }

        if (exception != null) {
            log.warn("[TX] EVENT: {}", format(event));
        } else {
            log.info("[TX] EVENT: {}", format(event));
        }
    }

    private String format(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("[TX] Event not serializable as JSON, falling back to toString: {}", e.getMessage());
            return event.toString();
        }
    }

    static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int linesToInclude = Math.min(STACK_TRACE_LINES, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < linesToInclude; i++) {
            if (i > 0) {
                summary.append(" | ");
            }
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_TRACE_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_TRACE_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
