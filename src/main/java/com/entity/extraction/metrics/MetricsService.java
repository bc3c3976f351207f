package com.entity.extraction.metrics;

import com.entity.extraction.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording extraction and disambiguation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void incrementEntitiesExtracted(String extractorName, EntityType type, int count);

    void incrementExtractorFailure(String extractorName);

    void incrementGroupsFormed(String method, int count);

    void incrementCoreferenceLinks(String referenceType, int count);

    void recordStageDuration(String stage, Duration duration);
}
