package com.entity.extraction.extraction;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtractionTablesLoader Tests")
class ExtractionTablesLoaderTest {

    private final ExtractionTablesLoader loader = new ExtractionTablesLoader();

    @Test
    @DisplayName("Should load tables from the classpath and ignore unknown keys")
    void loadsResource() {
        ExtractionTables tables = loader.loadResource("test-tables.json");

        assertEquals(1, tables.patterns().size());
        assertEquals("TicketKey", tables.patterns().get(0).name());
        assertEquals(2, tables.terms().size());
        assertNull(tables.terms().get(1).confidence());
    }

    @Test
    @DisplayName("Applied tables should drive extraction")
    void appliesTables() {
        PatternEntityExtractor patterns = new PatternEntityExtractor(ExtractionOptions.empty());
        DictionaryEntityExtractor dictionary = new DictionaryEntityExtractor(ExtractionOptions.empty());

        int registered = loader.apply(loader.loadResource("/test-tables.json"), patterns, dictionary);

        assertEquals(4, registered);
        String text = "Ticket PROJ-42 from Globex in Springfield";
        List<Entity> found = patterns.extractEntities(text, "doc", "tenant-a");
        assertEquals(1, found.size());
        assertEquals(EntityType.PROJECT, found.get(0).getType());

        List<Entity> terms = dictionary.extractEntities(text, "doc", "tenant-a");
        assertEquals(2, terms.size());
        assertEquals(0.9, dictionary.getConfidence(EntityType.ORGANIZATION, "globex"));
        assertEquals(1.0, dictionary.getConfidence(EntityType.LOCATION, "Springfield"));
    }

    @Test
    @DisplayName("Sections for a missing extractor are ignored")
    void nullExtractorIgnored() {
        DictionaryEntityExtractor dictionary = new DictionaryEntityExtractor(ExtractionOptions.empty());

        assertEquals(3, loader.apply(loader.loadResource("test-tables.json"), null, dictionary));
    }

    @Test
    @DisplayName("Should parse documents from a stream")
    void parsesStream() {
        String json = "{\"terms\":[{\"type\":\"Skill\",\"values\":[\"Kanban\"]}]}";

        ExtractionTables tables = loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertTrue(tables.patterns().isEmpty());
        assertEquals(List.of("Kanban"), tables.terms().get(0).values());
    }

    @Test
    @DisplayName("Malformed documents, missing resources and unknown types are rejected")
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{not json"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> loader.loadResource("missing-tables.json"));

        ExtractionTables unknownType = loader.parse(
                "{\"terms\":[{\"type\":\"Spaceship\",\"values\":[\"Enterprise\"]}]}");
        DictionaryEntityExtractor dictionary = new DictionaryEntityExtractor(ExtractionOptions.empty());
        assertThrows(IllegalArgumentException.class, () -> loader.apply(unknownType, null, dictionary));
    }

    @Test
    @DisplayName("The bundled sample tables should load")
    void bundledTables() {
        ExtractionTables tables = loader.loadResource("extraction-tables.json");

        assertFalse(tables.patterns().isEmpty());
        assertFalse(tables.terms().isEmpty());
    }
}
