package com.entity.extraction.cdi;

import com.entity.extraction.api.AsyncEntityRecognizer;
import com.entity.extraction.api.AsyncEntityRecognizerImpl;
import com.entity.extraction.api.NamedEntityRecognitionService;
import com.entity.extraction.disambiguation.DisambiguationFactory;
import com.entity.extraction.disambiguation.DisambiguationOptions;
import com.entity.extraction.disambiguation.DisambiguationService;
import com.entity.extraction.disambiguation.RandomDisambiguationIdGenerator;
import com.entity.extraction.extraction.DictionaryEntityExtractor;
import com.entity.extraction.extraction.EntityExtractionPipeline;
import com.entity.extraction.extraction.ExtractionOptions;
import com.entity.extraction.extraction.ExtractionTablesLoader;
import com.entity.extraction.extraction.PatternEntityExtractor;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.MicrometerMetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.repository.InMemoryKnownEntityRepository;
import com.entity.extraction.repository.KnownEntityRepository;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.OpenTelemetryTracingService;
import com.entity.extraction.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * CDI producer that wires the entity extraction library from MicroProfile Config properties.
 *
 * <p>All properties are optional:</p>
 * <pre>
 * entity-extraction:
 *   extraction:
 *     context-window: 100
 *     dictionary-case-sensitive: false
 *     tables-resource: extraction-tables.json
 *   disambiguation:
 *     name-threshold: 0.8
 *     context-threshold: 0.6
 *     coreference-window: 75
 *     max-entities: 5000
 * </pre>
 *
 * <p>A {@link MeterRegistry} or {@link Tracer} bean, when the container has one, backs
 * the metrics and tracing hooks; otherwise they are no-ops.</p>
 */
@ApplicationScoped
public class EntityExtractionProducer {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractionProducer.class);

    // ── Extraction ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-extraction.extraction.context-window", defaultValue = "100")
    int contextWindow;

    @Inject
    @ConfigProperty(name = "entity-extraction.extraction.dictionary-case-sensitive", defaultValue = "false")
    boolean dictionaryCaseSensitive;

    @Inject
    @ConfigProperty(name = "entity-extraction.extraction.tables-resource")
    Optional<String> tablesResource;

    // ── Disambiguation ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-extraction.disambiguation.name-threshold", defaultValue = "0.8")
    double nameThreshold;

    @Inject
    @ConfigProperty(name = "entity-extraction.disambiguation.context-threshold", defaultValue = "0.6")
    double contextThreshold;

    @Inject
    @ConfigProperty(name = "entity-extraction.disambiguation.coreference-window", defaultValue = "75")
    int coreferenceWindow;

    @Inject
    @ConfigProperty(name = "entity-extraction.disambiguation.max-entities", defaultValue = "5000")
    int maxEntities;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Metrics backed by Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics disabled: no MeterRegistry available");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (tracer != null && tracer.isResolvable()) {
            log.info("Tracing backed by OpenTelemetry");
            return new OpenTelemetryTracingService(tracer.get());
        }
        log.info("Tracing disabled: no Tracer available");
        return new NoOpTracingService();
    }

    @Produces
    @ApplicationScoped
    public KnownEntityRepository knownEntityRepository() {
        return new InMemoryKnownEntityRepository();
    }

    @Produces
    @ApplicationScoped
    public EntityExtractionPipeline entityExtractionPipeline(MetricsService metrics, TracingService tracing) {
        ExtractionOptions options = ExtractionOptions.builder()
                .contextWindow(contextWindow)
                .caseSensitiveDictionary(dictionaryCaseSensitive)
                .build();
        log.info("Producing EntityExtractionPipeline: {}", options);

        EntityExtractionPipeline pipeline = EntityExtractionPipeline.withDefaultExtractors(options, metrics, tracing);
        tablesResource.filter(path -> !path.isBlank()).ifPresent(path -> {
            ExtractionTablesLoader loader = new ExtractionTablesLoader();
            int registered = loader.apply(loader.loadResource(path),
                    pipeline.getExtractor(PatternEntityExtractor.NAME, PatternEntityExtractor.class),
                    pipeline.getExtractor(DictionaryEntityExtractor.NAME, DictionaryEntityExtractor.class));
            log.info("Extraction tables loaded: resource={} entries={}", path, registered);
        });
        return pipeline;
    }

    @Produces
    @ApplicationScoped
    public DisambiguationService disambiguationService(KnownEntityRepository repository,
                                                       MetricsService metrics, TracingService tracing) {
        DisambiguationOptions options = DisambiguationOptions.builder()
                .nameSimilarityThreshold(nameThreshold)
                .contextSimilarityThreshold(contextThreshold)
                .coreferenceContextWindow(coreferenceWindow)
                .maxEntitiesPerPass(maxEntities)
                .build();
        log.info("Producing DisambiguationService: {}", options);
        return new DisambiguationFactory(options, new RandomDisambiguationIdGenerator(), repository,
                metrics, tracing).createDisambiguationService();
    }

    @Produces
    @ApplicationScoped
    public NamedEntityRecognitionService namedEntityRecognitionService(EntityExtractionPipeline pipeline,
                                                                       DisambiguationService disambiguation) {
        return new NamedEntityRecognitionService(pipeline, disambiguation);
    }

    @Produces
    @ApplicationScoped
    public AsyncEntityRecognizer asyncEntityRecognizer(NamedEntityRecognitionService service) {
        return new AsyncEntityRecognizerImpl(service);
    }

    public void closeAsyncRecognizer(@Disposes AsyncEntityRecognizer recognizer) {
        log.info("Closing AsyncEntityRecognizer");
        recognizer.close();
    }
}
