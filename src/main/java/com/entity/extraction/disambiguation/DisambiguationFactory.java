package com.entity.extraction.disambiguation;

import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.repository.KnownEntityRepository;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.TracingService;

import java.util.List;

/**
 * Builds the default disambiguators, the coreference resolver and the service
 * that orchestrates them, sharing one id generator and one set of observers.
 */
public class DisambiguationFactory {

    private final DisambiguationOptions options;
    private final DisambiguationIdGenerator idGenerator;
    private final KnownEntityRepository repository;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public DisambiguationFactory() {
        this(DisambiguationOptions.defaults(), new RandomDisambiguationIdGenerator(), null,
                new NoOpMetricsService(), new NoOpTracingService());
    }

    /**
     * @param repository known-entity lookup for {@code findRelatedEntities}; may be null
     */
    public DisambiguationFactory(DisambiguationOptions options, DisambiguationIdGenerator idGenerator,
                                 KnownEntityRepository repository,
                                 MetricsService metricsService, TracingService tracingService) {
        this.options = options != null ? options : DisambiguationOptions.defaults();
        this.idGenerator = idGenerator != null ? idGenerator : new RandomDisambiguationIdGenerator();
        this.repository = repository;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    public NameBasedDisambiguator createNameBasedDisambiguator() {
        return new NameBasedDisambiguator(options.getNameSimilarityThreshold(), idGenerator,
                repository, metricsService, tracingService);
    }

    public ContextBasedDisambiguator createContextBasedDisambiguator() {
        return new ContextBasedDisambiguator(options.getContextSimilarityThreshold(), idGenerator,
                repository, metricsService, tracingService);
    }

    /**
     * Name-based first, then context-based.
     */
    public List<EntityDisambiguator> createAllDisambiguators() {
        return List.of(createNameBasedDisambiguator(), createContextBasedDisambiguator());
    }

    public CoreferenceResolver createCoreferenceResolver() {
        return new CoreferenceResolver(options.getCoreferenceContextWindow(), idGenerator,
                metricsService, tracingService);
    }

    public DisambiguationService createDisambiguationService() {
        return new DisambiguationService(createAllDisambiguators(), createCoreferenceResolver(),
                options.getMaxEntitiesPerPass());
    }

    public DisambiguationOptions getOptions() {
        return options;
    }
}
