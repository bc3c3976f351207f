package com.entity.extraction.extraction;

import com.entity.extraction.core.model.EntityType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.regex.Pattern;

/**
 * Loads extra patterns and dictionary terms from a JSON document and registers them
 * on the pattern and dictionary extractors.
 */
public class ExtractionTablesLoader {

    private static final Logger log = LoggerFactory.getLogger(ExtractionTablesLoader.class);

    private static final double DEFAULT_TERM_CONFIDENCE = 1.0;

    private final ObjectMapper objectMapper;

    public ExtractionTablesLoader() {
        this(new ObjectMapper());
    }

    public ExtractionTablesLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a tables document.
     *
     * @throws IllegalArgumentException if the document is not valid JSON of the expected shape
     */
    public ExtractionTables parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json must not be null or blank");
        }
        try {
            return objectMapper.readValue(json, ExtractionTables.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed extraction tables: " + e.getOriginalMessage(), e);
        }
    }

    public ExtractionTables parse(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        try {
            return objectMapper.readValue(input, ExtractionTables.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed extraction tables: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read extraction tables", e);
        }
    }

    /**
     * Reads a tables document from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist or is malformed
     */
    public ExtractionTables loadResource(String resourcePath) {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ExtractionTablesLoader.class.getClassLoader();
        }
        try (InputStream input = loader.getResourceAsStream(path)) {
            if (input == null) {
                throw new IllegalArgumentException("Extraction tables resource not found: " + resourcePath);
            }
            return parse(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close extraction tables resource " + resourcePath, e);
        }
    }

    /**
     * Registers every entry of the tables. Either extractor may be null, in which case
     * the matching section is ignored.
     *
     * @return the number of patterns and terms registered
     * @throws IllegalArgumentException if an entry names an unknown type or carries an invalid regex
     */
    public int apply(ExtractionTables tables, PatternEntityExtractor patterns, DictionaryEntityExtractor dictionary) {
        int registered = 0;
        if (patterns != null) {
            for (ExtractionTables.PatternEntry entry : tables.patterns()) {
                int flags = entry.caseInsensitive() ? Pattern.CASE_INSENSITIVE : 0;
                patterns.addPattern(EntityType.fromLabel(entry.type()), entry.name(), entry.regex(), flags);
                registered++;
            }
        }
        if (dictionary != null) {
            for (ExtractionTables.TermEntry entry : tables.terms()) {
                if (entry.values() == null) {
                    continue;
                }
                double confidence = entry.confidence() != null ? entry.confidence() : DEFAULT_TERM_CONFIDENCE;
                EntityType type = EntityType.fromLabel(entry.type());
                for (String value : entry.values()) {
                    if (value != null && !value.isBlank()) {
                        dictionary.addTerm(type, value, confidence);
                        registered++;
                    }
                }
            }
        }
        log.info("extraction.tables.applied registered={}", registered);
        return registered;
    }
}
