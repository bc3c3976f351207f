package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for extractors. Handles argument checks, the empty-text no-op,
 * context windows and the structured-data rendering shared by every strategy.
 */
public abstract class AbstractEntityExtractor implements EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(AbstractEntityExtractor.class);

    private final String name;
    private final int contextWindow;

    protected AbstractEntityExtractor(String name, int contextWindow) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must not be negative");
        }
        this.name = name;
        this.contextWindow = contextWindow;
    }

    @Override
    public final List<Entity> extractEntities(String text, String sourceId, String tenantId) {
        requireTenant(tenantId);
        if (text == null || text.isEmpty()) {
            log.warn("extraction.skipped extractor={} sourceId={} reason=empty-text", name, sourceId);
            return List.of();
        }

        List<Entity> entities = doExtract(text, sourceId, tenantId);
        log.debug("extraction.completed extractor={} sourceId={} count={}", name, sourceId, entities.size());
        return entities;
    }

    /**
     * Scans non-empty text. Called after argument validation.
     */
    protected abstract List<Entity> doExtract(String text, String sourceId, String tenantId);

    @Override
    public List<Entity> extractEntitiesFromStructuredData(Map<String, ?> data, String sourceId, String tenantId) {
        requireTenant(tenantId);
        if (data == null || data.isEmpty()) {
            log.warn("extraction.skipped extractor={} sourceId={} reason=empty-data", name, sourceId);
            return List.of();
        }

        StringBuilder content = new StringBuilder();
        List<String> fieldNames = new ArrayList<>();
        List<Integer> lineEnds = new ArrayList<>();
        for (Map.Entry<String, ?> field : data.entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            content.append(field.getKey()).append(": ").append(field.getValue()).append('\n');
            fieldNames.add(field.getKey());
            lineEnds.add(content.length());
        }

        List<Entity> extracted = extractEntities(content.toString(), sourceId, tenantId);
        List<Entity> tagged = new ArrayList<>(extracted.size());
        for (Entity entity : extracted) {
            String fieldName = entity.hasPosition()
                    ? fieldAt(entity.getStartPosition(), fieldNames, lineEnds)
                    : null;
            tagged.add(fieldName == null ? entity : Entity.builder(entity)
                    .attribute(AttributeKeys.FIELD_NAME, AttributeValue.text(fieldName))
                    .build());
        }
        return tagged;
    }

    private static String fieldAt(int position, List<String> fieldNames, List<Integer> lineEnds) {
        for (int i = 0; i < lineEnds.size(); i++) {
            if (position < lineEnds.get(i)) {
                return fieldNames.get(i);
            }
        }
        return null;
    }

    @Override
    public String getName() {
        return name;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    /**
     * Returns the text surrounding a match: {@code contextWindow} characters on each
     * side, clipped to the text bounds.
     */
    protected String contextAround(String text, int matchIndex, int matchLength) {
        int start = Math.max(0, matchIndex - contextWindow);
        int length = Math.min(text.length() - start, matchLength + 2 * contextWindow);
        return text.substring(start, start + length);
    }

    /**
     * Builds an entity anchored at {@code [start, start + length)} of {@code text}.
     */
    protected Entity createEntity(String value, EntityType type, double confidence,
                                  String text, int start, int length,
                                  String sourceId, String tenantId,
                                  Map<String, AttributeValue> attributes) {
        return Entity.builder()
                .name(value)
                .type(type)
                .confidenceScore(confidence)
                .sourceId(sourceId)
                .tenantId(tenantId)
                .span(start, start + length)
                .originalContext(contextAround(text, start, length))
                .attributes(attributes)
                .build();
    }

    protected static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    protected static double clampConfidence(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
