package com.entity.extraction.repository;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link KnownEntityRepository}.
 * Thread-safe via concurrent maps keyed by tenant, then entity id.
 */
public class InMemoryKnownEntityRepository implements KnownEntityRepository {

    private final Map<String, Map<String, Entity>> entitiesByTenant = new ConcurrentHashMap<>();

    @Override
    public List<Entity> findByType(String tenantId, EntityType type) {
        Map<String, Entity> entities = entitiesByTenant.get(tenantId);
        if (entities == null) {
            return List.of();
        }
        return entities.values().stream()
                .filter(e -> e.getType() == type)
                .collect(Collectors.toList());
    }

    @Override
    public Entity save(Entity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        entitiesByTenant
                .computeIfAbsent(entity.getTenantId(), t -> new ConcurrentHashMap<>())
                .put(entity.getId(), entity);
        return entity;
    }

    @Override
    public int count(String tenantId) {
        Map<String, Entity> entities = entitiesByTenant.get(tenantId);
        return entities == null ? 0 : entities.size();
    }
}
