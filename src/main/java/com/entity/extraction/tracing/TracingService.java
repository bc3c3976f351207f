package com.entity.extraction.tracing;

import java.util.Map;

/**
 * Tracing seam for the pipeline stages ({@code entity.extract},
 * {@code entity.disambiguate}, {@code entity.coreference}).
 * {@link NoOpTracingService} keeps the library usable without a tracing backend.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
