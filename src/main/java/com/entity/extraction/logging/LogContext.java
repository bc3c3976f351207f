package com.entity.extraction.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so contexts may be nested.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forExtraction("doc-42", "tenant-a")) {
 *     log.info("extraction.completed count={}", entities.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for running the extractors over one text unit.
     */
    public static LogContext forExtraction(String sourceId, String tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("sourceId", sourceId);
        ctx.put("tenantId", tenantId);
        ctx.put("operation", "extract");
        return ctx;
    }

    /**
     * Creates a log context for a disambiguation pass.
     */
    public static LogContext forDisambiguation(String tenantId, String method) {
        LogContext ctx = new LogContext();
        ctx.put("tenantId", tenantId);
        ctx.put("disambiguationMethod", method);
        ctx.put("operation", "disambiguate");
        return ctx;
    }

    /**
     * Creates a log context for coreference resolution.
     */
    public static LogContext forCoreference(String tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("tenantId", tenantId);
        ctx.put("operation", "coreference");
        return ctx;
    }

    /**
     * Creates a log context for a full recognition run (extract, disambiguate, resolve).
     */
    public static LogContext forRecognition(String correlationId, String sourceId, String tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceId", sourceId);
        ctx.put("tenantId", tenantId);
        ctx.put("operation", "recognize");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
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
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
