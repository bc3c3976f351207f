package com.entity.extraction.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An entity mention found in a text unit, optionally linked to a canonical identity
 * through its disambiguation id.
 * Instances are immutable; stages produce updated copies via {@link #builder(Entity)}
 * or the {@code with*} methods, which keep the original id.
 */
public final class Entity {
    private final String id;
    private final String name;
    private final EntityType type;
    private final double confidenceScore;
    private final String sourceId;
    private final String tenantId;
    private final Integer startPosition;
    private final Integer endPosition;
    private final String originalContext;
    private final Map<String, AttributeValue> attributes;
    private final String disambiguationId;
    private final Instant createdAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.type = builder.type;
        this.confidenceScore = builder.confidenceScore;
        this.sourceId = builder.sourceId;
        this.tenantId = builder.tenantId;
        this.startPosition = builder.startPosition;
        this.endPosition = builder.endPosition;
        this.originalContext = builder.originalContext;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.disambiguationId = builder.disambiguationId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EntityType getType() {
        return type;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTenantId() {
        return tenantId;
    }

    /**
     * Character offset of the mention in its source text, or null when the entity
     * is not tied to a literal span.
     */
    public Integer getStartPosition() {
        return startPosition;
    }

    public Integer getEndPosition() {
        return endPosition;
    }

    public boolean hasPosition() {
        return startPosition != null;
    }

    public String getOriginalContext() {
        return originalContext;
    }

    public boolean hasContext() {
        return originalContext != null && !originalContext.isEmpty();
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    public Optional<AttributeValue> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public String getDisambiguationId() {
        return disambiguationId;
    }

    public boolean isDisambiguated() {
        return disambiguationId != null && !disambiguationId.isEmpty();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy carrying the given disambiguation id.
     */
    public Entity withDisambiguationId(String newDisambiguationId) {
        return builder(this).disambiguationId(newDisambiguationId).build();
    }

    /**
     * Returns a copy with the given attributes added (existing keys are replaced).
     */
    public Entity withAttributes(Map<String, AttributeValue> extra) {
        return builder(this).attributes(extra).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", confidenceScore=" + confidenceScore +
                ", span=" + startPosition + ".." + endPosition +
                ", disambiguationId='" + disambiguationId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .type(entity.type)
                .confidenceScore(entity.confidenceScore)
                .sourceId(entity.sourceId)
                .tenantId(entity.tenantId)
                .span(entity.startPosition, entity.endPosition)
                .originalContext(entity.originalContext)
                .attributes(entity.attributes)
                .disambiguationId(entity.disambiguationId)
                .createdAt(entity.createdAt);
    }

    public static class Builder {
        private String id;
        private String name;
        private EntityType type;
        private double confidenceScore = 1.0;
        private String sourceId;
        private String tenantId;
        private Integer startPosition;
        private Integer endPosition;
        private String originalContext;
        private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        private String disambiguationId;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder span(Integer startPosition, Integer endPosition) {
            this.startPosition = startPosition;
            this.endPosition = endPosition;
            return this;
        }

        public Builder originalContext(String originalContext) {
            this.originalContext = originalContext;
            return this;
        }

        public Builder attribute(String key, AttributeValue value) {
            Objects.requireNonNull(key, "attribute key is required");
            Objects.requireNonNull(value, "attribute value is required");
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, AttributeValue> values) {
            if (values != null) {
                values.forEach(this::attribute);
            }
            return this;
        }

        public Builder disambiguationId(String disambiguationId) {
            this.disambiguationId = disambiguationId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(tenantId, "tenantId is required");
            if (confidenceScore < 0.0 || confidenceScore > 1.0) {
                throw new IllegalArgumentException("confidenceScore must be between 0.0 and 1.0");
            }
            if (startPosition != null && endPosition != null && endPosition < startPosition) {
                throw new IllegalArgumentException("endPosition must be >= startPosition");
            }
            return new Entity(this);
        }
    }
}
