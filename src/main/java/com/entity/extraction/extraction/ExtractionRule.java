package com.entity.extraction.extraction;

import com.entity.extraction.core.model.EntityType;

import java.util.List;
import java.util.Objects;

/**
 * A named heuristic that finds entities of one type in text.
 * The matcher returns every hit; all hits share the rule's confidence.
 */
public class ExtractionRule {

    /**
     * Finds rule hits in a text.
     */
    @FunctionalInterface
    public interface Matcher {
        List<RuleMatch> match(String text);
    }

    private static final double DEFAULT_CONFIDENCE = 0.7;

    private final String name;
    private final EntityType entityType;
    private final Matcher matcher;
    private final double confidence;

    private ExtractionRule(Builder builder) {
        this.name = builder.name;
        this.entityType = builder.entityType;
        this.matcher = builder.matcher;
        this.confidence = Math.max(0.0, Math.min(1.0, builder.confidence));
    }

    public String getName() {
        return name;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<RuleMatch> apply(String text) {
        List<RuleMatch> matches = matcher.match(text);
        return matches != null ? matches : List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExtractionRule that = (ExtractionRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ExtractionRule{" +
                "name='" + name + '\'' +
                ", entityType=" + entityType +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private EntityType entityType;
        private Matcher matcher;
        private double confidence = DEFAULT_CONFIDENCE;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder matcher(Matcher matcher) {
            this.matcher = matcher;
            return this;
        }

        /**
         * Confidence for every hit; values outside [0, 1] are clamped.
         */
        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public ExtractionRule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            if (matcher == null) {
                throw new IllegalArgumentException("matcher must not be null");
            }
            Objects.requireNonNull(entityType, "entityType is required");
            return new ExtractionRule(this);
        }
    }
}
