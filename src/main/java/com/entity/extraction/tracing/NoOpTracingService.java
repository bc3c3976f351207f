package com.entity.extraction.tracing;

import java.util.Map;

/**
 * No-op implementation of {@link TracingService}.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void fail(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }
}
