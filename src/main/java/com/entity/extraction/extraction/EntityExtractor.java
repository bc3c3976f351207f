package com.entity.extraction.extraction;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A strategy that scans text and produces candidate entity mentions.
 * Implementations hold only configuration tables and may be shared across threads.
 */
public interface EntityExtractor {

    /**
     * Extracts entity mentions from a text unit.
     * Null or empty text yields an empty list; extraction never fails on malformed text.
     *
     * @param text     the text to scan
     * @param sourceId identifier of the originating document (may be null)
     * @param tenantId tenant isolation key
     * @return the extracted entities in discovery order
     * @throws IllegalArgumentException if tenantId is null or blank
     */
    List<Entity> extractEntities(String text, String sourceId, String tenantId);

    /**
     * Extracts entities from field/value data. Each non-null field is rendered as a
     * {@code key: value} line and scanned as text; entities found on a line carry the
     * field name in their {@code FieldName} attribute.
     */
    List<Entity> extractEntitiesFromStructuredData(Map<String, ?> data, String sourceId, String tenantId);

    Set<EntityType> getSupportedEntityTypes();

    /**
     * Name used for pipeline filtering, logs and metrics.
     */
    String getName();
}
