package com.speaker.standardization.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close, so contexts nest.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forSource(runId, "bigspeak_scraper")) {
 *     log.info("ingest.source.completed inserted={} updated={}", inserted, updated);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // Values the keys had before this context, restored on close
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole unification run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "unify");
        return ctx;
    }

    /**
     * Creates a log context for the ingestion of one source.
     */
    public static LogContext forSource(String runId, String sourceName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("source", sourceName);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for a bulk flush.
     */
    public static LogContext forFlush(String sourceName, long offset) {
        LogContext ctx = new LogContext();
        ctx.put("source", sourceName);
        ctx.put("offset", Long.toString(offset));
        ctx.put("operation", "flush");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
