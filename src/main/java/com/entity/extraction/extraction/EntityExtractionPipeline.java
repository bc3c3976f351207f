package com.entity.extraction.extraction;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.logging.LogContext;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.Span;
import com.entity.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Runs the registered extractors over one text unit and concatenates their results
 * in registration order. Mentions found by several extractors are all kept.
 *
 * <p>An extractor that throws is logged and skipped; the others still contribute,
 * so callers get partial results rather than a failure.</p>
 */
public class EntityExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractionPipeline.class);

    private final List<EntityExtractor> extractors = new CopyOnWriteArrayList<>();
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public EntityExtractionPipeline() {
        this(new NoOpMetricsService(), new NoOpTracingService());
    }

    public EntityExtractionPipeline(MetricsService metricsService, TracingService tracingService) {
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Creates a pipeline with the pattern, dictionary and rule-based extractors.
     */
    public static EntityExtractionPipeline withDefaultExtractors(ExtractionOptions options,
                                                                 MetricsService metricsService,
                                                                 TracingService tracingService) {
        EntityExtractionPipeline pipeline = new EntityExtractionPipeline(metricsService, tracingService);
        pipeline.registerExtractor(new PatternEntityExtractor(options));
        pipeline.registerExtractor(new DictionaryEntityExtractor(options));
        pipeline.registerExtractor(new RuleBasedEntityExtractor(options));
        return pipeline;
    }

    public static EntityExtractionPipeline withDefaultExtractors() {
        return withDefaultExtractors(ExtractionOptions.defaults(), null, null);
    }

    public List<Entity> process(String text, String sourceId, String tenantId) {
        return process(text, sourceId, tenantId, null);
    }

    /**
     * Extracts entities with the extractors whose names are listed, or all of them when
     * {@code extractorNames} is null or empty.
     *
     * @throws IllegalArgumentException if tenantId is null or blank
     */
    public List<Entity> process(String text, String sourceId, String tenantId, Set<String> extractorNames) {
        AbstractEntityExtractor.requireTenant(tenantId);
        if (text == null || text.isEmpty()) {
            log.warn("pipeline.skipped sourceId={} reason=empty-text", sourceId);
            return List.of();
        }
        return run("text", sourceId, tenantId, extractorNames,
                extractor -> extractor.extractEntities(text, sourceId, tenantId));
    }

    public List<Entity> processStructuredData(Map<String, ?> data, String sourceId, String tenantId) {
        return processStructuredData(data, sourceId, tenantId, null);
    }

    /**
     * Extracts entities from field/value data with the selected extractors.
     *
     * @throws IllegalArgumentException if tenantId is null or blank
     */
    public List<Entity> processStructuredData(Map<String, ?> data, String sourceId, String tenantId,
                                              Set<String> extractorNames) {
        AbstractEntityExtractor.requireTenant(tenantId);
        if (data == null || data.isEmpty()) {
            log.warn("pipeline.skipped sourceId={} reason=empty-data", sourceId);
            return List.of();
        }
        return run("structured", sourceId, tenantId, extractorNames,
                extractor -> extractor.extractEntitiesFromStructuredData(data, sourceId, tenantId));
    }

    private List<Entity> run(String input, String sourceId, String tenantId, Set<String> extractorNames,
                             Function<EntityExtractor, List<Entity>> invocation) {
        List<EntityExtractor> selected = select(extractorNames);
        if (selected.isEmpty()) {
            log.warn("pipeline.skipped sourceId={} reason=no-extractors requested={}", sourceId, extractorNames);
            return List.of();
        }

        long startNanos = System.nanoTime();
        List<Entity> all = new ArrayList<>();
        try (LogContext ignored = LogContext.forExtraction(sourceId, tenantId);
             Span span = tracingService.startSpan("entity.extract",
                     Map.of("tenantId", tenantId, "input", input))) {
            for (EntityExtractor extractor : selected) {
                try {
                    List<Entity> found = invocation.apply(extractor);
                    if (found != null) {
                        all.addAll(found);
                        recordCounts(extractor.getName(), found);
                        log.debug("pipeline.extractor.completed extractor={} count={}",
                                extractor.getName(), found.size());
                    }
                } catch (RuntimeException e) {
                    metricsService.incrementExtractorFailure(extractor.getName());
                    log.error("pipeline.extractor.error extractor={} sourceId={} error={}",
                            extractor.getName(), sourceId, e.getMessage(), e);
                }
            }
            span.setAttribute("entityCount", all.size());
            log.info("pipeline.completed sourceId={} extractors={} count={}", sourceId, selected.size(), all.size());
        } finally {
            metricsService.recordStageDuration("extract", Duration.ofNanos(System.nanoTime() - startNanos));
        }
        return all;
    }

    private void recordCounts(String extractorName, List<Entity> found) {
        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        for (Entity entity : found) {
            counts.merge(entity.getType(), 1, Integer::sum);
        }
        counts.forEach((type, count) -> metricsService.incrementEntitiesExtracted(extractorName, type, count));
    }

    private List<EntityExtractor> select(Set<String> extractorNames) {
        if (extractorNames == null || extractorNames.isEmpty()) {
            return List.copyOf(extractors);
        }
        List<EntityExtractor> selected = new ArrayList<>();
        for (EntityExtractor extractor : extractors) {
            if (extractorNames.contains(extractor.getName())) {
                selected.add(extractor);
            }
        }
        return selected;
    }

    /**
     * Adds an extractor; it runs after those already registered.
     *
     * @throws IllegalArgumentException if extractor is null
     */
    public void registerExtractor(EntityExtractor extractor) {
        if (extractor == null) {
            throw new IllegalArgumentException("extractor must not be null");
        }
        extractors.add(extractor);
        log.info("pipeline.extractor.registered extractor={} types={}",
                extractor.getName(), extractor.getSupportedEntityTypes());
    }

    public List<EntityExtractor> getRegisteredExtractors() {
        return List.copyOf(extractors);
    }

    /**
     * Returns the union of the types the registered extractors can produce.
     */
    public Set<EntityType> getSupportedEntityTypes() {
        Set<EntityType> types = new LinkedHashSet<>();
        for (EntityExtractor extractor : extractors) {
            types.addAll(extractor.getSupportedEntityTypes());
        }
        return types;
    }

    /**
     * Finds a registered extractor by name and type.
     */
    public <T extends EntityExtractor> T getExtractor(String name, Class<T> type) {
        for (EntityExtractor extractor : extractors) {
            if (extractor.getName().equals(name) && type.isInstance(extractor)) {
                return type.cast(extractor);
            }
        }
        return null;
    }
}
