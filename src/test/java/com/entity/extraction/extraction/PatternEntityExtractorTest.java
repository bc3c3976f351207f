package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternEntityExtractor Tests")
class PatternEntityExtractorTest {

    private static final String TENANT = "tenant-a";

    private final PatternEntityExtractor extractor = new PatternEntityExtractor();

    private static List<Entity> ofType(List<Entity> entities, EntityType type) {
        return entities.stream().filter(e -> e.getType() == type).toList();
    }

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatternTests {

        @Test
        @DisplayName("Should find exactly one email and one phone number")
        void emailAndPhone() {
            String text = "Contact me at a@b.com or call 555-123-4567.";

            List<Entity> entities = extractor.extractEntities(text, "doc-1", TENANT);

            assertEquals(2, entities.size());
            Entity email = ofType(entities, EntityType.EMAIL).get(0);
            Entity phone = ofType(entities, EntityType.PHONE_NUMBER).get(0);

            assertEquals("a@b.com", email.getName());
            assertEquals(0.9, email.getConfidenceScore());
            assertEquals(14, email.getStartPosition());
            assertEquals(21, email.getEndPosition());
            assertEquals("StandardEmail", email.getAttribute(AttributeKeys.PATTERN_NAME).orElseThrow().raw());

            assertEquals("555-123-4567", phone.getName());
            assertEquals(0.9, phone.getConfidenceScore());
            assertEquals("doc-1", phone.getSourceId());
            assertEquals(TENANT, phone.getTenantId());
        }

        @ParameterizedTest
        @CsvSource({
                "'Released on 2024-03-15.', DATE_TIME, 2024-03-15",
                "'Growth was 12.5% this year', PERCENTAGE, 12.5%",
                "'Docs at https://example.com/docs today', URL, https://example.com/docs",
                "'It costs $ 20.50 now', MONEY, $ 20.50"
        })
        @DisplayName("Should recognize common formats")
        void commonFormats(String text, EntityType type, String expected) {
            List<Entity> found = ofType(extractor.extractEntities(text, "doc", TENANT), type);

            assertEquals(1, found.size());
            assertEquals(expected, found.get(0).getName());
        }

        @Test
        @DisplayName("Named groups should become attributes")
        void namedGroupsBecomeAttributes() {
            List<Entity> entities = extractor.extractEntities("SELECT name FROM users", "q", TENANT);

            Entity table = ofType(entities, EntityType.DATABASE_TABLE).get(0);
            Entity column = ofType(entities, EntityType.DATABASE_COLUMN).get(0);

            assertEquals("FROM users", table.getName());
            assertEquals("users", table.getAttribute("Table").orElseThrow().raw());
            assertEquals("name", column.getAttribute("Column").orElseThrow().raw());
        }
    }

    @Nested
    @DisplayName("Context window")
    class ContextTests {

        @Test
        @DisplayName("Context should keep the configured number of characters on each side")
        void clipsContext() {
            PatternEntityExtractor narrow = new PatternEntityExtractor(
                    ExtractionOptions.builder().contextWindow(5).build());

            Entity email = narrow.extractEntities("xxxxxxxxxx a@b.com yyyyyyyyyy", "doc", TENANT).get(0);

            assertEquals("xxxx a@b.com yyyy", email.getOriginalContext());
        }

        @Test
        @DisplayName("Context should be clipped at the text bounds")
        void clipsAtBounds() {
            PatternEntityExtractor narrow = new PatternEntityExtractor(
                    ExtractionOptions.builder().contextWindow(5).build());

            Entity email = narrow.extractEntities("a@b.com end", "doc", TENANT).get(0);

            assertEquals("a@b.com end", email.getOriginalContext());
        }

        @Test
        @DisplayName("A short text is its own context with the default window")
        void wholeTextContext() {
            String text = "Mail a@b.com please";
            Entity email = extractor.extractEntities(text, "doc", TENANT).get(0);

            assertEquals(text, email.getOriginalContext());
        }
    }

    @Nested
    @DisplayName("Custom patterns")
    class CustomPatternTests {

        @Test
        @DisplayName("Should extract with a registered pattern")
        void registeredPattern() {
            PatternEntityExtractor custom = new PatternEntityExtractor(ExtractionOptions.empty());
            custom.addPattern(EntityType.PROJECT, "Ticket", "\\bproj-(?<Number>\\d+)\\b", Pattern.CASE_INSENSITIVE);

            List<Entity> entities = custom.extractEntities("See PROJ-7 and proj-12", "doc", TENANT);

            assertEquals(2, entities.size());
            assertEquals("7", entities.get(0).getAttribute("Number").orElseThrow().raw());
            assertEquals("proj-12", entities.get(1).getName());
            assertEquals(List.of("Number"), custom.getPatterns(EntityType.PROJECT).get(0).getGroupNames());
        }

        @Test
        @DisplayName("Zero-length matches should be skipped")
        void zeroLengthMatchesSkipped() {
            PatternEntityExtractor custom = new PatternEntityExtractor(ExtractionOptions.empty());
            custom.addPattern(EntityType.CUSTOM, "Optional", "z*");

            assertTrue(custom.extractEntities("abc", "doc", TENANT).isEmpty());
        }

        @Test
        @DisplayName("Invalid or blank patterns should be rejected")
        void invalidPatterns() {
            assertThrows(IllegalArgumentException.class,
                    () -> extractor.addPattern(EntityType.CUSTOM, "Broken", "(unclosed"));
            assertThrows(IllegalArgumentException.class,
                    () -> extractor.addPattern(EntityType.CUSTOM, " ", "abc"));
            assertThrows(IllegalArgumentException.class,
                    () -> extractor.addPattern(EntityType.CUSTOM, "Empty", ""));
        }

        @Test
        @DisplayName("Supported types should reflect registered patterns")
        void supportedTypes() {
            PatternEntityExtractor custom = new PatternEntityExtractor(ExtractionOptions.empty());
            assertTrue(custom.getSupportedEntityTypes().isEmpty());

            custom.addPattern(EntityType.API, "Path", "/v1/\\w+");

            assertEquals(java.util.Set.of(EntityType.API), custom.getSupportedEntityTypes());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTests {

        @Test
        @DisplayName("Empty text yields no entities")
        void emptyText() {
            assertTrue(extractor.extractEntities("", "doc", TENANT).isEmpty());
            assertTrue(extractor.extractEntities(null, "doc", TENANT).isEmpty());
        }

        @Test
        @DisplayName("A blank tenant is rejected")
        void blankTenant() {
            assertThrows(IllegalArgumentException.class,
                    () -> extractor.extractEntities("a@b.com", "doc", " "));
        }
    }
}
