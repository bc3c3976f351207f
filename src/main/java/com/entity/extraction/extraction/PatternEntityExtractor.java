package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts entities with regular expressions grouped by entity type.
 * Every match becomes one entity with a fixed confidence of {@value #MATCH_CONFIDENCE};
 * overlapping matches of different patterns are all kept.
 */
public class PatternEntityExtractor extends AbstractEntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(PatternEntityExtractor.class);

    public static final String NAME = "Pattern";
    public static final double MATCH_CONFIDENCE = 0.9;

    // Copy-on-write: extraction reads a stable snapshot while patterns are added.
    private volatile Map<EntityType, List<NamedPattern>> patterns = Map.of();

    public PatternEntityExtractor() {
        this(ExtractionOptions.defaults());
    }

    public PatternEntityExtractor(ExtractionOptions options) {
        super(NAME, options.getContextWindow());
        if (options.isIncludeDefaultPatterns()) {
            registerDefaultPatterns();
        }
    }

    @Override
    protected List<Entity> doExtract(String text, String sourceId, String tenantId) {
        List<Entity> entities = new ArrayList<>();
        for (Map.Entry<EntityType, List<NamedPattern>> entry : patterns.entrySet()) {
            for (NamedPattern pattern : entry.getValue()) {
                try {
                    collectMatches(pattern, entry.getKey(), text, sourceId, tenantId, entities);
                } catch (RuntimeException e) {
                    log.error("extraction.pattern.error pattern={} type={} error={}",
                            pattern.getName(), entry.getKey(), e.getMessage(), e);
                }
            }
        }
        return entities;
    }

    private void collectMatches(NamedPattern pattern, EntityType type, String text,
                                String sourceId, String tenantId, List<Entity> sink) {
        // Matches are buffered so a pattern failing midway contributes nothing.
        List<Entity> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            Map<String, AttributeValue> attributes = new LinkedHashMap<>();
            attributes.put(AttributeKeys.PATTERN_NAME, AttributeValue.text(pattern.getName()));
            for (String group : pattern.getGroupNames()) {
                String value = matcher.group(group);
                if (value != null) {
                    attributes.put(group, AttributeValue.text(value));
                }
            }
            found.add(createEntity(matcher.group(), type, MATCH_CONFIDENCE, text,
                    matcher.start(), matcher.end() - matcher.start(), sourceId, tenantId, attributes));
        }
        sink.addAll(found);
    }

    @Override
    public Set<EntityType> getSupportedEntityTypes() {
        return Set.copyOf(patterns.keySet());
    }

    /**
     * Registers a pattern for the given type.
     *
     * @param flags {@link Pattern} compile flags
     * @throws IllegalArgumentException if the name or regex is blank or the regex is invalid
     */
    public void addPattern(EntityType type, String patternName, String regex, int flags) {
        if (type == null) {
            throw new IllegalArgumentException("entityType must not be null");
        }
        NamedPattern compiled = NamedPattern.of(patternName, regex, flags);
        synchronized (this) {
            Map<EntityType, List<NamedPattern>> copy = new LinkedHashMap<>();
            patterns.forEach((t, list) -> copy.put(t, new ArrayList<>(list)));
            copy.computeIfAbsent(type, t -> new ArrayList<>()).add(compiled);
            copy.replaceAll((t, list) -> List.copyOf(list));
            patterns = copy;
        }
        log.debug("extraction.pattern.added pattern={} type={}", patternName, type);
    }

    public void addPattern(EntityType type, String patternName, String regex) {
        addPattern(type, patternName, regex, 0);
    }

    /**
     * Returns the registered patterns for a type, in registration order.
     */
    public List<NamedPattern> getPatterns(EntityType type) {
        return patterns.getOrDefault(type, List.of());
    }

    private void registerDefaultPatterns() {
        addPattern(EntityType.EMAIL, "StandardEmail",
                "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b",
                Pattern.CASE_INSENSITIVE);

        addPattern(EntityType.URL, "StandardUrl",
                "(https?://(?:www\\.|(?!www))[a-zA-Z0-9][a-zA-Z0-9-]+[a-zA-Z0-9]\\.[^\\s]{2,}"
                        + "|www\\.[a-zA-Z0-9][a-zA-Z0-9-]+[a-zA-Z0-9]\\.[^\\s]{2,}"
                        + "|https?://(?:www\\.|(?!www))[a-zA-Z0-9]+\\.[^\\s]{2,}"
                        + "|www\\.[a-zA-Z0-9]+\\.[^\\s]{2,})",
                Pattern.CASE_INSENSITIVE);

        addPattern(EntityType.PHONE_NUMBER, "USPhoneNumber",
                "\\b(\\+\\d{1,2}\\s?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b");

        addPattern(EntityType.DATE_TIME, "ISODate", "\\b\\d{4}-\\d{2}-\\d{2}\\b");
        addPattern(EntityType.DATE_TIME, "USDate", "\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b");
        addPattern(EntityType.DATE_TIME, "EUDate", "\\b\\d{1,2}\\.\\d{1,2}\\.\\d{2,4}\\b");

        addPattern(EntityType.MONEY, "USD", "\\$\\s?\\d+(?:\\.\\d{2})?");
        addPattern(EntityType.MONEY, "EUR", "€\\s?\\d+(?:,\\d{2})?");
        addPattern(EntityType.MONEY, "GBP", "£\\s?\\d+(?:\\.\\d{2})?");

        // No trailing word boundary: '%' followed by a space or end of text must still match.
        addPattern(EntityType.PERCENTAGE, "StandardPercentage", "\\b\\d+(?:\\.\\d+)?%");

        addPattern(EntityType.DATABASE_TABLE, "SQLTableName",
                "\\b(?:from|join|update|into)\\s+(?<Table>[a-zA-Z][a-zA-Z0-9_]*)\\b",
                Pattern.CASE_INSENSITIVE);
        addPattern(EntityType.DATABASE_COLUMN, "SQLColumnName",
                "\\b(?:select|where|group\\s+by|order\\s+by)\\s+(?<Column>[a-zA-Z][a-zA-Z0-9_]*)\\b",
                Pattern.CASE_INSENSITIVE);

        addPattern(EntityType.CODE_SNIPPET, "FunctionDeclaration",
                "\\b(?:function|def|public|private|protected|void|async|static)\\s+"
                        + "(?<FunctionName>[a-zA-Z][a-zA-Z0-9_]*)\\s*\\(",
                Pattern.CASE_INSENSITIVE);
    }
}
