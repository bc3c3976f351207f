package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts entities by looking up known terms.
 *
 * <p>Single-token terms are matched against the text's tokens (split on whitespace and
 * punctuation). Terms that span a delimiter, such as {@code "Machine Learning"} or
 * {@code "CI/CD"}, are located by scanning the raw text; occurrences of one term
 * never overlap. Matching ignores case unless the extractor is case-sensitive.</p>
 */
public class DictionaryEntityExtractor extends AbstractEntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(DictionaryEntityExtractor.class);

    public static final String NAME = "Dictionary";

    private static final String DELIMITERS = " \t\n\r,;.:!?()[]{}<>/\\\"'";

    private final boolean caseSensitive;

    // Copy-on-write: type -> (comparison key -> confidence), insertion ordered.
    private volatile Map<EntityType, Map<String, Double>> dictionaries = Map.of();

    public DictionaryEntityExtractor() {
        this(ExtractionOptions.defaults());
    }

    public DictionaryEntityExtractor(ExtractionOptions options) {
        super(NAME, options.getContextWindow());
        this.caseSensitive = options.isCaseSensitiveDictionary();
        if (options.isIncludeDefaultTerms()) {
            DefaultDictionaries.register(this);
        }
    }

    @Override
    protected List<Entity> doExtract(String text, String sourceId, String tenantId) {
        List<Token> tokens = tokenize(text);
        List<Entity> entities = new ArrayList<>();

        for (Map.Entry<EntityType, Map<String, Double>> entry : dictionaries.entrySet()) {
            EntityType type = entry.getKey();
            Map<String, Double> terms = entry.getValue();
            String attributeValue = "Dictionary:" + type.getLabel();

            for (Token token : tokens) {
                Double confidence = terms.get(key(token.value()));
                if (confidence != null) {
                    entities.add(createEntity(token.value(), type, confidence, text,
                            token.start(), token.value().length(), sourceId, tenantId,
                            Map.of(AttributeKeys.PATTERN_NAME, AttributeValue.text(attributeValue))));
                }
            }

            for (Map.Entry<String, Double> term : terms.entrySet()) {
                if (!spansDelimiter(term.getKey())) {
                    continue;
                }
                int termLength = term.getKey().length();
                int index = indexOf(text, term.getKey(), 0);
                while (index >= 0) {
                    entities.add(createEntity(text.substring(index, index + termLength), type,
                            term.getValue(), text, index, termLength, sourceId, tenantId,
                            Map.of(AttributeKeys.PATTERN_NAME, AttributeValue.text(attributeValue))));
                    index = indexOf(text, term.getKey(), index + termLength);
                }
            }
        }
        return entities;
    }

    @Override
    public Set<EntityType> getSupportedEntityTypes() {
        return Set.copyOf(dictionaries.keySet());
    }

    /**
     * Adds a term with the given confidence, clamped to [0, 1].
     * Re-adding a term replaces its confidence.
     *
     * @throws IllegalArgumentException if the term is null or blank
     */
    public void addTerm(EntityType type, String term, double confidence) {
        if (type == null) {
            throw new IllegalArgumentException("entityType must not be null");
        }
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("term must not be null or blank");
        }
        double clamped = clampConfidence(confidence);
        synchronized (this) {
            Map<EntityType, Map<String, Double>> copy = new LinkedHashMap<>();
            dictionaries.forEach((t, terms) -> copy.put(t, new LinkedHashMap<>(terms)));
            copy.computeIfAbsent(type, t -> new LinkedHashMap<>()).put(key(term), clamped);
            dictionaries = copy;
        }
        log.trace("extraction.term.added term={} type={} confidence={}", term, type, clamped);
    }

    public void addTerm(EntityType type, String term) {
        addTerm(type, term, 1.0);
    }

    /**
     * Adds every non-blank term of the collection with one confidence.
     *
     * @throws IllegalArgumentException if terms is null
     */
    public void addTerms(EntityType type, Collection<String> terms, double confidence) {
        if (terms == null) {
            throw new IllegalArgumentException("terms must not be null");
        }
        int added = 0;
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                addTerm(type, term, confidence);
                added++;
            }
        }
        log.debug("extraction.terms.added type={} count={}", type, added);
    }

    /**
     * Returns the confidence configured for a term, or null if the term is unknown.
     */
    public Double getConfidence(EntityType type, String term) {
        Map<String, Double> terms = dictionaries.get(type);
        return terms == null || term == null ? null : terms.get(key(term));
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    private String key(String term) {
        return caseSensitive ? term : term.toLowerCase(Locale.ROOT);
    }

    private int indexOf(String text, String term, int from) {
        int last = text.length() - term.length();
        for (int i = from; i <= last; i++) {
            if (text.regionMatches(!caseSensitive, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean spansDelimiter(String term) {
        for (int i = 0; i < term.length(); i++) {
            if (DELIMITERS.indexOf(term.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            boolean delimiter = DELIMITERS.indexOf(text.charAt(i)) >= 0;
            if (delimiter && start >= 0) {
                tokens.add(new Token(text.substring(start, i), start));
                start = -1;
            } else if (!delimiter && start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            tokens.add(new Token(text.substring(start), start));
        }
        return tokens;
    }

    record Token(String value, int start) {
    }
}
