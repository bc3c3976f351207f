package com.entity.extraction.disambiguation;

/**
 * Options for disambiguation and coreference resolution.
 * Configures similarity thresholds, the coreference context window and the input cap.
 */
public class DisambiguationOptions {

    private static final double DEFAULT_NAME_SIMILARITY_THRESHOLD = 0.8;
    private static final double DEFAULT_CONTEXT_SIMILARITY_THRESHOLD = 0.6;
    private static final int DEFAULT_COREFERENCE_CONTEXT_WINDOW = 75;
    private static final int DEFAULT_MAX_ENTITIES_PER_PASS = 5_000;

    private final double nameSimilarityThreshold;
    private final double contextSimilarityThreshold;
    private final int coreferenceContextWindow;
    private final int maxEntitiesPerPass;

    private DisambiguationOptions(Builder builder) {
        this.nameSimilarityThreshold = builder.nameSimilarityThreshold;
        this.contextSimilarityThreshold = builder.contextSimilarityThreshold;
        this.coreferenceContextWindow = builder.coreferenceContextWindow;
        this.maxEntitiesPerPass = builder.maxEntitiesPerPass;
    }

    public double getNameSimilarityThreshold() {
        return nameSimilarityThreshold;
    }

    public double getContextSimilarityThreshold() {
        return contextSimilarityThreshold;
    }

    public int getCoreferenceContextWindow() {
        return coreferenceContextWindow;
    }

    /**
     * Largest entity list accepted by one disambiguation run; grouping is quadratic
     * in the number of entities.
     */
    public int getMaxEntitiesPerPass() {
        return maxEntitiesPerPass;
    }

    public static DisambiguationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double nameSimilarityThreshold = DEFAULT_NAME_SIMILARITY_THRESHOLD;
        private double contextSimilarityThreshold = DEFAULT_CONTEXT_SIMILARITY_THRESHOLD;
        private int coreferenceContextWindow = DEFAULT_COREFERENCE_CONTEXT_WINDOW;
        private int maxEntitiesPerPass = DEFAULT_MAX_ENTITIES_PER_PASS;

        public Builder nameSimilarityThreshold(double nameSimilarityThreshold) {
            validateThreshold(nameSimilarityThreshold, "nameSimilarityThreshold");
            this.nameSimilarityThreshold = nameSimilarityThreshold;
            return this;
        }

        public Builder contextSimilarityThreshold(double contextSimilarityThreshold) {
            validateThreshold(contextSimilarityThreshold, "contextSimilarityThreshold");
            this.contextSimilarityThreshold = contextSimilarityThreshold;
            return this;
        }

        public Builder coreferenceContextWindow(int coreferenceContextWindow) {
            if (coreferenceContextWindow < 0) {
                throw new IllegalArgumentException("coreferenceContextWindow must not be negative");
            }
            this.coreferenceContextWindow = coreferenceContextWindow;
            return this;
        }

        public Builder maxEntitiesPerPass(int maxEntitiesPerPass) {
            if (maxEntitiesPerPass <= 0) {
                throw new IllegalArgumentException("maxEntitiesPerPass must be positive");
            }
            this.maxEntitiesPerPass = maxEntitiesPerPass;
            return this;
        }

        public DisambiguationOptions build() {
            return new DisambiguationOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "DisambiguationOptions{" +
                "nameSimilarityThreshold=" + nameSimilarityThreshold +
                ", contextSimilarityThreshold=" + contextSimilarityThreshold +
                ", coreferenceContextWindow=" + coreferenceContextWindow +
                ", maxEntitiesPerPass=" + maxEntitiesPerPass +
                '}';
    }
}
