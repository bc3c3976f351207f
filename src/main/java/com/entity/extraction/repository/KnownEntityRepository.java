package com.entity.extraction.repository;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;

import java.util.Collection;
import java.util.List;

/**
 * Lookup of entities already known to the knowledge graph, per tenant.
 * Implementations provide different storage backends; the pipeline only reads from it
 * when relating a mention to known entities.
 */
public interface KnownEntityRepository {

    /**
     * Gets the known entities of one type for a tenant.
     */
    List<Entity> findByType(String tenantId, EntityType type);

    /**
     * Saves an entity under its own tenant, replacing an entity with the same id.
     */
    Entity save(Entity entity);

    /**
     * Saves several entities.
     */
    default void saveAll(Collection<Entity> entities) {
        for (Entity entity : entities) {
            save(entity);
        }
    }

    /**
     * Gets the number of entities stored for a tenant.
     */
    int count(String tenantId);
}
