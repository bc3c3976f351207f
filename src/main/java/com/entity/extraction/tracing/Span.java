package com.entity.extraction.tracing;

/**
 * A unit of work in a trace, closed with try-with-resources.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("entity.extract")) {
 *     span.setAttribute("entityCount", entities.size());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the span as failed and attaches the exception.
     */
    void fail(Throwable t);

    @Override
    void close();
}
