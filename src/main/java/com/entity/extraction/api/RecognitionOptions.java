package com.entity.extraction.api;

import java.util.Set;

/**
 * Options for one recognition run: which stages run after extraction and which
 * extractors take part.
 */
public class RecognitionOptions {

    private final boolean performDisambiguation;
    private final boolean resolveCoreferences;
    private final Set<String> extractorNames;

    private RecognitionOptions(Builder builder) {
        this.performDisambiguation = builder.performDisambiguation;
        this.resolveCoreferences = builder.resolveCoreferences;
        this.extractorNames = builder.extractorNames;
    }

    public boolean isPerformDisambiguation() {
        return performDisambiguation;
    }

    public boolean isResolveCoreferences() {
        return resolveCoreferences;
    }

    /**
     * Names of the extractors to run; empty means all registered extractors.
     */
    public Set<String> getExtractorNames() {
        return extractorNames;
    }

    public static RecognitionOptions defaults() {
        return builder().build();
    }

    /**
     * Extraction only, no disambiguation or coreference resolution.
     */
    public static RecognitionOptions extractionOnly() {
        return builder()
                .performDisambiguation(false)
                .resolveCoreferences(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean performDisambiguation = true;
        private boolean resolveCoreferences = true;
        private Set<String> extractorNames = Set.of();

        public Builder performDisambiguation(boolean performDisambiguation) {
            this.performDisambiguation = performDisambiguation;
            return this;
        }

        public Builder resolveCoreferences(boolean resolveCoreferences) {
            this.resolveCoreferences = resolveCoreferences;
            return this;
        }

        public Builder extractorNames(Set<String> extractorNames) {
            this.extractorNames = extractorNames != null ? Set.copyOf(extractorNames) : Set.of();
            return this;
        }

        public Builder extractorNames(String... extractorNames) {
            return extractorNames(Set.of(extractorNames));
        }

        public RecognitionOptions build() {
            return new RecognitionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "RecognitionOptions{" +
                "performDisambiguation=" + performDisambiguation +
                ", resolveCoreferences=" + resolveCoreferences +
                ", extractorNames=" + extractorNames +
                '}';
    }
}
