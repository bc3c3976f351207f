package com.entity.extraction.metrics;

import com.entity.extraction.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementEntitiesExtracted(String extractorName, EntityType type, int count) {
    }

    @Override
    public void incrementExtractorFailure(String extractorName) {
    }

    @Override
    public void incrementGroupsFormed(String method, int count) {
    }

    @Override
    public void incrementCoreferenceLinks(String referenceType, int count) {
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }
}
