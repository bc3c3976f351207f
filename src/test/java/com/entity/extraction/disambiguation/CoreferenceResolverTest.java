package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.tracing.NoOpTracingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entity.extraction.disambiguation.DisambiguationTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CoreferenceResolver Tests")
class CoreferenceResolverTest {

    private final CoreferenceResolver resolver =
            new CoreferenceResolver(CoreferenceResolver.DEFAULT_CONTEXT_WINDOW, sequentialIds());

    @Nested
    @DisplayName("Pronouns")
    class PronounTests {

        @Test
        @DisplayName("A pronoun should link to the closest preceding person")
        void nearestPrecedingPerson() {
            String text = "John met Sarah. He left.";
            Entity john = at("John", EntityType.PERSON, 0);
            Entity sarah = at("Sarah", EntityType.PERSON, 9);

            List<Entity> result = resolver.resolveCoreferences(text, List.of(john, sarah), TENANT);

            assertEquals(3, result.size());
            Entity he = result.get(2);
            assertEquals("He", he.getName());
            assertEquals(EntityType.PERSON, he.getType());
            assertEquals(16, he.getStartPosition());
            assertEquals(18, he.getEndPosition());
            assertEquals(result.get(1).getDisambiguationId(), he.getDisambiguationId());
            assertNull(result.get(0).getDisambiguationId());
            assertEquals(AttributeValue.entityRef(sarah.getId()),
                    he.getAttribute(AttributeKeys.REFERENCE_TARGET).orElseThrow());
        }

        @Test
        @DisplayName("An antecedent without an id should receive one shared with the reference")
        void backfillsId() {
            String text = "Ann Lee joined. Everyone welcomed her.";
            Entity ann = at("Ann Lee", EntityType.PERSON, 0);

            List<Entity> result = resolver.resolveCoreferences(text, List.of(ann), TENANT);

            assertEquals(2, result.size());
            assertEquals("dis-1", result.get(0).getDisambiguationId());
            assertEquals(ann.getId(), result.get(0).getId());
            Entity her = result.get(1);
            assertEquals("dis-1", her.getDisambiguationId());
            assertEquals(CoreferenceResolver.REFERENCE_CONFIDENCE, her.getConfidenceScore());
            assertEquals(CoreferenceResolver.PRONOUN,
                    her.getAttribute(AttributeKeys.REFERENCE_TYPE).orElseThrow().raw());
            assertEquals(text, her.getOriginalContext());
        }

        @Test
        @DisplayName("An antecedent that already has an id keeps it")
        void keepsExistingId() {
            Entity bob = Entity.builder(at("Bob", EntityType.PERSON, 0)).disambiguationId("dis-known").build();

            List<Entity> result = resolver.resolveCoreferences("Bob said he would come.", List.of(bob), TENANT);

            assertSame(bob, result.get(0));
            assertEquals("dis-known", result.get(1).getDisambiguationId());
        }

        @Test
        @DisplayName("Pronouns before any person, or inside words, are not linked")
        void unlinkedPronouns() {
            String text = "He said John left. The theme changed.";
            Entity john = at("John", EntityType.PERSON, 8);

            List<Entity> result = resolver.resolveCoreferences(text, List.of(john), TENANT);

            assertEquals(1, result.size());
            assertSame(john, result.get(0));
        }
    }

    @Nested
    @DisplayName("Organization references")
    class OrganizationTests {

        @Test
        @DisplayName("\"The company\" should link to the closest preceding organization")
        void organizationPhrase() {
            String text = "Acme Corp. announced results. The company grew.";
            Entity acme = Entity.builder(at("Acme Corp.", EntityType.ORGANIZATION, 0))
                    .disambiguationId("dis-7")
                    .build();

            List<Entity> result = resolver.resolveCoreferences(text, List.of(acme), TENANT);

            assertEquals(2, result.size());
            Entity reference = result.get(1);
            assertEquals("The company", reference.getName());
            assertEquals(EntityType.ORGANIZATION, reference.getType());
            assertEquals("dis-7", reference.getDisambiguationId());
            assertEquals(CoreferenceResolver.ORGANIZATION_REFERENCE,
                    reference.getAttribute(AttributeKeys.REFERENCE_TYPE).orElseThrow().raw());
        }

        @Test
        @DisplayName("Pronouns never link to organizations")
        void pronounsIgnoreOrganizations() {
            Entity acme = at("Acme", EntityType.ORGANIZATION, 0);

            List<Entity> result = resolver.resolveCoreferences("Acme says they will grow.", List.of(acme), TENANT);

            assertEquals(1, result.size());
        }
    }

    @Nested
    @DisplayName("Eligibility and validation")
    class ValidationTests {

        @Test
        @DisplayName("Entities without a position or from another tenant are not antecedents")
        void ineligibleAntecedents() {
            Entity unplaced = entity("John", EntityType.PERSON, 0.9);
            Entity foreign = Entity.builder(at("Mary", EntityType.PERSON, 0)).tenantId("tenant-b").build();

            List<Entity> result = resolver.resolveCoreferences("Mary and John said he agreed.",
                    List.of(unplaced, foreign), TENANT);

            assertEquals(2, result.size());
        }

        @Test
        @DisplayName("Invalid arguments are rejected and no entities yields an empty list")
        void validation() {
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.resolveCoreferences("", List.of(), TENANT));
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.resolveCoreferences("text", null, TENANT));
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.resolveCoreferences("text", List.of(), " "));
            assertTrue(resolver.resolveCoreferences("He left.", List.of(), TENANT).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> new CoreferenceResolver(-1, null));
        }

        @Test
        @DisplayName("Links are counted per reference type")
        void countsLinks() {
            MetricsService metrics = mock(MetricsService.class);
            CoreferenceResolver observed = new CoreferenceResolver(75, sequentialIds(), metrics,
                    new NoOpTracingService());

            observed.resolveCoreferences("Tom waved and he smiled.",
                    List.of(at("Tom", EntityType.PERSON, 0)), TENANT);

            verify(metrics).incrementCoreferenceLinks(CoreferenceResolver.PRONOUN, 1);
            verify(metrics).incrementCoreferenceLinks(CoreferenceResolver.ORGANIZATION_REFERENCE, 0);
        }
    }
}
