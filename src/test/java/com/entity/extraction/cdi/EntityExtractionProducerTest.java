package com.entity.extraction.cdi;

import com.entity.extraction.api.AsyncEntityRecognizer;
import com.entity.extraction.api.NamedEntityRecognitionService;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.disambiguation.CoreferenceResolver;
import com.entity.extraction.disambiguation.DisambiguationService;
import com.entity.extraction.disambiguation.EntityDisambiguator;
import com.entity.extraction.extraction.EntityExtractionPipeline;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.MicrometerMetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.repository.InMemoryKnownEntityRepository;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.OpenTelemetryTracingService;
import com.entity.extraction.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("EntityExtractionProducer Tests")
class EntityExtractionProducerTest {

    private EntityExtractionProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        producer = new EntityExtractionProducer();
        producer.contextWindow = 100;
        producer.dictionaryCaseSensitive = false;
        producer.tablesResource = Optional.empty();
        producer.nameThreshold = 0.8;
        producer.contextThreshold = 0.6;
        producer.coreferenceWindow = 40;
        producer.maxEntities = 5000;
        producer.meterRegistry = mock(Instance.class);
        producer.tracer = mock(Instance.class);
    }

    @Nested
    @DisplayName("Observability")
    class ObservabilityTests {

        @Test
        @DisplayName("Should fall back to no-op services without registry or tracer")
        void noOpFallback() {
            when(producer.meterRegistry.isResolvable()).thenReturn(false);
            when(producer.tracer.isResolvable()).thenReturn(false);

            assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
            assertInstanceOf(NoOpTracingService.class, producer.tracingService());
        }

        @Test
        @DisplayName("Should use the container's registry and tracer when present")
        void backedServices() {
            MeterRegistry registry = new SimpleMeterRegistry();
            when(producer.meterRegistry.isResolvable()).thenReturn(true);
            when(producer.meterRegistry.get()).thenReturn(registry);
            when(producer.tracer.isResolvable()).thenReturn(true);
            when(producer.tracer.get()).thenReturn(mock(Tracer.class));

            assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
            assertInstanceOf(OpenTelemetryTracingService.class, producer.tracingService());
        }
    }

    @Nested
    @DisplayName("Library wiring")
    class WiringTests {

        private final MetricsService metrics = new NoOpMetricsService();
        private final TracingService tracing = new NoOpTracingService();

        @Test
        @DisplayName("Pipeline should register the tables resource")
        void pipelineWithTables() {
            producer.tablesResource = Optional.of("test-tables.json");

            EntityExtractionPipeline pipeline = producer.entityExtractionPipeline(metrics, tracing);
            List<Entity> entities = pipeline.process("Ticket PROJ-42 from Globex", "doc-1", "tenant-a");

            assertTrue(entities.stream().anyMatch(e -> e.getType() == EntityType.PROJECT
                    && e.getName().equals("PROJ-42")));
            assertTrue(entities.stream().anyMatch(e -> e.getType() == EntityType.ORGANIZATION
                    && e.getName().equals("Globex")));
        }

        @Test
        @DisplayName("Blank tables resource should be ignored")
        void blankTablesResource() {
            producer.tablesResource = Optional.of(" ");

            EntityExtractionPipeline pipeline = producer.entityExtractionPipeline(metrics, tracing);

            assertFalse(pipeline.getRegisteredExtractors().isEmpty());
        }

        @Test
        @DisplayName("Disambiguation service should carry the configured options")
        void disambiguationServiceOptions() {
            DisambiguationService service = producer.disambiguationService(
                    new InMemoryKnownEntityRepository(), metrics, tracing);

            List<EntityDisambiguator> disambiguators = service.getDisambiguators();
            assertEquals(2, disambiguators.size());
            CoreferenceResolver resolver = service.getCoreferenceResolver();
            assertEquals(40, resolver.getContextWindow());
        }

        @Test
        @DisplayName("Produced services should work end to end")
        void endToEnd() {
            EntityExtractionPipeline pipeline = producer.entityExtractionPipeline(metrics, tracing);
            DisambiguationService disambiguation = producer.disambiguationService(
                    producer.knownEntityRepository(), metrics, tracing);
            NamedEntityRecognitionService service = producer.namedEntityRecognitionService(pipeline, disambiguation);

            List<Entity> entities = service.extractEntities("Mail jane@example.com today", "doc-1", "tenant-a");

            assertTrue(entities.stream().anyMatch(e -> e.getType() == EntityType.EMAIL));
        }

        @Test
        @DisplayName("Disposer should close the async recognizer")
        void disposerClosesRecognizer() {
            AsyncEntityRecognizer recognizer = mock(AsyncEntityRecognizer.class);

            producer.closeAsyncRecognizer(recognizer);

            verify(recognizer).close();
        }
    }
}
