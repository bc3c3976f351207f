package com.entity.extraction.api;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.disambiguation.DisambiguationFactory;
import com.entity.extraction.disambiguation.DisambiguationService;
import com.entity.extraction.extraction.EntityExtractionPipeline;
import com.entity.extraction.extraction.EntityExtractor;
import com.entity.extraction.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Main entry point: extracts entities from a text unit, groups duplicate mentions
 * and links coreferent references.
 *
 * <p>The run is synchronous. The calling thread's interrupt flag is checked between
 * stages; when it is set the run stops with a {@link CancellationException} and the
 * flag is left set.</p>
 *
 * <p>When extraction yields more entities than one disambiguation pass accepts, the
 * grouping stage is skipped with a warning and the entities are returned ungrouped.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * NamedEntityRecognitionService service = NamedEntityRecognitionService.createDefault();
 * List&lt;Entity&gt; entities = service.extractEntities(text, "doc-1", "tenant-a");
 * </pre>
 */
public class NamedEntityRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(NamedEntityRecognitionService.class);

    private final EntityExtractionPipeline pipeline;
    private final DisambiguationService disambiguationService;

    public NamedEntityRecognitionService(EntityExtractionPipeline pipeline,
                                         DisambiguationService disambiguationService) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.disambiguationService = Objects.requireNonNull(disambiguationService, "disambiguationService is required");
    }

    /**
     * Creates a service with the default extractors, disambiguators and resolver.
     */
    public static NamedEntityRecognitionService createDefault() {
        return new NamedEntityRecognitionService(
                EntityExtractionPipeline.withDefaultExtractors(),
                new DisambiguationFactory().createDisambiguationService());
    }

    public List<Entity> extractEntities(String text, String sourceId, String tenantId) {
        return extractEntities(text, sourceId, tenantId, RecognitionOptions.defaults());
    }

    /**
     * Extracts entities, then optionally disambiguates them and resolves coreferences.
     *
     * @throws IllegalArgumentException if tenantId is null or blank
     * @throws CancellationException    if the calling thread is interrupted between stages
     */
    public List<Entity> extractEntities(String text, String sourceId, String tenantId, RecognitionOptions options) {
        RecognitionOptions opts = options != null ? options : RecognitionOptions.defaults();
        try (LogContext ignored = LogContext.forRecognition(LogContext.generateCorrelationId(), sourceId, tenantId)) {
            checkCancelled("extract");
            List<Entity> entities = pipeline.process(text, sourceId, tenantId, opts.getExtractorNames());
            if (entities.isEmpty()) {
                return entities;
            }

            if (opts.isPerformDisambiguation() && withinDisambiguationCap(sourceId, entities)) {
                checkCancelled("disambiguate");
                entities = disambiguationService.processEntities(entities, tenantId);
            }
            if (opts.isResolveCoreferences()) {
                checkCancelled("coreference");
                entities = disambiguationService.resolveCoreferences(text, entities, tenantId);
            }
            log.info("recognition.completed sourceId={} count={}", sourceId, entities.size());
            return entities;
        }
    }

    public List<Entity> extractEntitiesFromStructuredData(Map<String, ?> data, String sourceId, String tenantId) {
        return extractEntitiesFromStructuredData(data, sourceId, tenantId, RecognitionOptions.defaults());
    }

    /**
     * Extracts entities from field/value data and optionally disambiguates them.
     * Coreference resolution does not apply to structured data.
     */
    public List<Entity> extractEntitiesFromStructuredData(Map<String, ?> data, String sourceId, String tenantId,
                                                          RecognitionOptions options) {
        RecognitionOptions opts = options != null ? options : RecognitionOptions.defaults();
        try (LogContext ignored = LogContext.forRecognition(LogContext.generateCorrelationId(), sourceId, tenantId)) {
            checkCancelled("extract");
            List<Entity> entities = pipeline.processStructuredData(data, sourceId, tenantId, opts.getExtractorNames());
            if (entities.isEmpty() || !opts.isPerformDisambiguation()
                    || !withinDisambiguationCap(sourceId, entities)) {
                return entities;
            }
            checkCancelled("disambiguate");
            List<Entity> disambiguated = disambiguationService.processEntities(entities, tenantId);
            log.info("recognition.structured.completed sourceId={} count={}", sourceId, disambiguated.size());
            return disambiguated;
        }
    }

    public List<Entity> disambiguateEntities(List<Entity> entities, String tenantId) {
        return disambiguationService.processEntities(entities, tenantId);
    }

    public List<Entity> resolveCoreferences(String text, List<Entity> entities, String tenantId) {
        return disambiguationService.resolveCoreferences(text, entities, tenantId);
    }

    public List<Entity> resolveAgainstKnowledgeGraph(Entity entity, String tenantId) {
        return disambiguationService.resolveAgainstKnowledgeGraph(entity, tenantId);
    }

    public Set<EntityType> getSupportedEntityTypes() {
        return pipeline.getSupportedEntityTypes();
    }

    public List<EntityExtractor> getRegisteredExtractors() {
        return pipeline.getRegisteredExtractors();
    }

    public EntityExtractionPipeline getPipeline() {
        return pipeline;
    }

    private boolean withinDisambiguationCap(String sourceId, List<Entity> entities) {
        int max = disambiguationService.getMaxEntitiesPerPass();
        if (entities.size() <= max) {
            return true;
        }
        log.warn("recognition.disambiguation.skipped sourceId={} count={} max={}", sourceId, entities.size(), max);
        return false;
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("recognition.cancelled stage={}", stage);
            throw new CancellationException("Recognition cancelled before stage " + stage);
        }
    }
}
