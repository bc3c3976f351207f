package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("EntityExtractionPipeline Tests")
class EntityExtractionPipelineTest {

    private static final String TENANT = "tenant-a";
    private static final String TEXT = "Contact me at a@b.com or call 555-123-4567.";

    private MetricsService metrics;
    private EntityExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        metrics = mock(MetricsService.class);
        pipeline = EntityExtractionPipeline.withDefaultExtractors(ExtractionOptions.defaults(), metrics,
                new NoOpTracingService());
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Default pipeline should register three extractors in order")
        void defaultExtractors() {
            List<String> names = pipeline.getRegisteredExtractors().stream()
                    .map(EntityExtractor::getName)
                    .toList();

            assertEquals(List.of(PatternEntityExtractor.NAME, DictionaryEntityExtractor.NAME,
                    RuleBasedEntityExtractor.NAME), names);
        }

        @Test
        @DisplayName("Supported types should be the union over extractors")
        void supportedTypesUnion() {
            Set<EntityType> types = pipeline.getSupportedEntityTypes();

            assertTrue(types.contains(EntityType.EMAIL));
            assertTrue(types.contains(EntityType.SKILL));
            assertTrue(types.contains(EntityType.API));
        }

        @Test
        @DisplayName("Extractors can be looked up by name and type")
        void lookupByName() {
            assertNotNull(pipeline.getExtractor(PatternEntityExtractor.NAME, PatternEntityExtractor.class));
            assertNull(pipeline.getExtractor(PatternEntityExtractor.NAME, DictionaryEntityExtractor.class));
            assertNull(pipeline.getExtractor("Missing", EntityExtractor.class));
        }

        @Test
        @DisplayName("Null extractors should be rejected")
        void rejectsNull() {
            assertThrows(IllegalArgumentException.class, () -> pipeline.registerExtractor(null));
        }
    }

    @Nested
    @DisplayName("Processing")
    class ProcessingTests {

        @Test
        @DisplayName("Should concatenate extractor results and record counts")
        void concatenatesResults() {
            List<Entity> entities = pipeline.process(TEXT, "doc-1", TENANT);

            assertEquals(2, entities.size());
            verify(metrics).incrementEntitiesExtracted(PatternEntityExtractor.NAME, EntityType.EMAIL, 1);
            verify(metrics).incrementEntitiesExtracted(PatternEntityExtractor.NAME, EntityType.PHONE_NUMBER, 1);
            verify(metrics).recordStageDuration(eq("extract"), any(Duration.class));
        }

        @Test
        @DisplayName("Overlapping mentions from different extractors are all kept")
        void keepsDuplicatesAcrossExtractors() {
            List<Entity> entities = pipeline.process("Globex Corporation and Microsoft Corporation", "doc", TENANT);

            long microsoft = entities.stream()
                    .filter(e -> e.getType() == EntityType.ORGANIZATION)
                    .filter(e -> e.getName().startsWith("Microsoft"))
                    .count();
            assertEquals(2, microsoft);
        }

        @Test
        @DisplayName("Only the named extractors should run")
        void filtersByName() {
            List<Entity> entities = pipeline.process(TEXT + " Dr. Jane Doe", "doc", TENANT,
                    Set.of(RuleBasedEntityExtractor.NAME));

            assertFalse(entities.isEmpty());
            assertTrue(entities.stream().allMatch(e -> e.getAttribute(AttributeKeys.RULE_NAME).isPresent()));
        }

        @Test
        @DisplayName("Unknown extractor names select nothing")
        void unknownNames() {
            assertTrue(pipeline.process(TEXT, "doc", TENANT, Set.of("Nope")).isEmpty());
        }

        @Test
        @DisplayName("A failing extractor should not stop the others")
        void failingExtractorSkipped() {
            EntityExtractor broken = mock(EntityExtractor.class);
            when(broken.getName()).thenReturn("Broken");
            when(broken.extractEntities(anyString(), anyString(), anyString()))
                    .thenThrow(new IllegalStateException("boom"));
            pipeline.registerExtractor(broken);

            List<Entity> entities = pipeline.process(TEXT, "doc", TENANT);

            assertEquals(2, entities.size());
            verify(metrics).incrementExtractorFailure("Broken");
        }

        @Test
        @DisplayName("Empty text yields an empty list and a blank tenant is rejected")
        void inputValidation() {
            assertTrue(pipeline.process("", "doc", TENANT).isEmpty());
            assertTrue(pipeline.process(null, "doc", TENANT).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> pipeline.process(TEXT, "doc", ""));
            assertThrows(IllegalArgumentException.class, () -> pipeline.process(TEXT, "doc", null));
        }
    }

    @Nested
    @DisplayName("Structured data")
    class StructuredDataTests {

        @Test
        @DisplayName("Entities should be tagged with the field they came from")
        void tagsFieldName() {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("email", "a@b.com");
            record.put("phone", "555-123-4567");
            record.put("notes", null);

            List<Entity> entities = pipeline.processStructuredData(record, "row-1", TENANT,
                    Set.of(PatternEntityExtractor.NAME));

            assertEquals(2, entities.size());
            Entity email = entities.stream().filter(e -> e.getType() == EntityType.EMAIL).findFirst().orElseThrow();
            Entity phone = entities.stream().filter(e -> e.getType() == EntityType.PHONE_NUMBER).findFirst().orElseThrow();
            assertEquals("email", email.getAttribute(AttributeKeys.FIELD_NAME).orElseThrow().raw());
            assertEquals("phone", phone.getAttribute(AttributeKeys.FIELD_NAME).orElseThrow().raw());
        }

        @Test
        @DisplayName("Empty data yields an empty list")
        void emptyData() {
            assertTrue(pipeline.processStructuredData(Map.of(), "row", TENANT).isEmpty());
            assertTrue(pipeline.processStructuredData(null, "row", TENANT).isEmpty());
        }
    }
}
