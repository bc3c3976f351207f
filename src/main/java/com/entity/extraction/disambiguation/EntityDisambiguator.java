package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;

import java.util.List;
import java.util.Set;

/**
 * A strategy that groups entity mentions referring to the same real-world entity
 * and links each group through a shared disambiguation id.
 */
public interface EntityDisambiguator {

    /**
     * Groups the entities of supported types belonging to {@code tenantId}.
     * Returns a new list in input order; grouped entities are replaced by tagged copies,
     * everything else is passed through unchanged. Entities that already carry a
     * disambiguation id keep it.
     *
     * @throws IllegalArgumentException if entities is null or tenantId is blank
     */
    List<Entity> disambiguateEntities(List<Entity> entities, String tenantId);

    /**
     * Finds known entities (from the configured repository) similar to the given one.
     * Returns an empty list when no repository is configured.
     */
    List<Entity> findRelatedEntities(Entity entity, String tenantId);

    Set<EntityType> getSupportedEntityTypes();

    /**
     * Value written to the {@code DisambiguationMethod} attribute, e.g. "Name".
     */
    String getMethodName();
}
