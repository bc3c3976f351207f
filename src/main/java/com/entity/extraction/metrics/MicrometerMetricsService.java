package com.entity.extraction.metrics;

import com.entity.extraction.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.extraction.count}: Counter (tags: extractor, entityType)</li>
 *   <li>{@code entity.extraction.failures}: Counter (tag: extractor)</li>
 *   <li>{@code entity.disambiguation.groups}: Counter (tag: method)</li>
 *   <li>{@code entity.coreference.links}: Counter (tag: referenceType)</li>
 *   <li>{@code entity.pipeline.stage.duration}: Timer (tag: stage)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementEntitiesExtracted(String extractorName, EntityType type, int count) {
        String key = "extracted:" + extractorName + ":" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("entity.extraction.count")
                        .description("Number of entity mentions extracted")
                        .tag("extractor", extractorName)
                        .tag("entityType", type.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementExtractorFailure(String extractorName) {
        String key = "failure:" + extractorName;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("entity.extraction.failures")
                        .description("Number of extractor runs dropped after an error")
                        .tag("extractor", extractorName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementGroupsFormed(String method, int count) {
        String key = "groups:" + method;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("entity.disambiguation.groups")
                        .description("Number of disambiguation groups formed")
                        .tag("method", method)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementCoreferenceLinks(String referenceType, int count) {
        String key = "coref:" + referenceType;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("entity.coreference.links")
                        .description("Number of references linked to an antecedent")
                        .tag("referenceType", referenceType)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("entity.pipeline.stage.duration")
                        .description("Duration of extraction pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }
}
