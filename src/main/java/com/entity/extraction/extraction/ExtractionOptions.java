package com.entity.extraction.extraction;

/**
 * Options for the default extractors.
 * Configures the context window and which built-in tables are loaded.
 */
public class ExtractionOptions {

    private static final int DEFAULT_CONTEXT_WINDOW = 100;

    private final int contextWindow;
    private final boolean caseSensitiveDictionary;
    private final boolean includeDefaultPatterns;
    private final boolean includeDefaultTerms;
    private final boolean includeDefaultRules;

    private ExtractionOptions(Builder builder) {
        this.contextWindow = builder.contextWindow;
        this.caseSensitiveDictionary = builder.caseSensitiveDictionary;
        this.includeDefaultPatterns = builder.includeDefaultPatterns;
        this.includeDefaultTerms = builder.includeDefaultTerms;
        this.includeDefaultRules = builder.includeDefaultRules;
    }

    /**
     * Characters of surrounding text kept on each side of a match.
     */
    public int getContextWindow() {
        return contextWindow;
    }

    public boolean isCaseSensitiveDictionary() {
        return caseSensitiveDictionary;
    }

    public boolean isIncludeDefaultPatterns() {
        return includeDefaultPatterns;
    }

    public boolean isIncludeDefaultTerms() {
        return includeDefaultTerms;
    }

    public boolean isIncludeDefaultRules() {
        return includeDefaultRules;
    }

    public static ExtractionOptions defaults() {
        return builder().build();
    }

    /**
     * Options with no built-in patterns, terms or rules; tables are expected
     * to be registered by the caller.
     */
    public static ExtractionOptions empty() {
        return builder()
                .includeDefaultPatterns(false)
                .includeDefaultTerms(false)
                .includeDefaultRules(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int contextWindow = DEFAULT_CONTEXT_WINDOW;
        private boolean caseSensitiveDictionary = false;
        private boolean includeDefaultPatterns = true;
        private boolean includeDefaultTerms = true;
        private boolean includeDefaultRules = true;

        public Builder contextWindow(int contextWindow) {
            if (contextWindow < 0) {
                throw new IllegalArgumentException("contextWindow must not be negative");
            }
            this.contextWindow = contextWindow;
            return this;
        }

        public Builder caseSensitiveDictionary(boolean caseSensitiveDictionary) {
            this.caseSensitiveDictionary = caseSensitiveDictionary;
            return this;
        }

        public Builder includeDefaultPatterns(boolean includeDefaultPatterns) {
            this.includeDefaultPatterns = includeDefaultPatterns;
            return this;
        }

        public Builder includeDefaultTerms(boolean includeDefaultTerms) {
            this.includeDefaultTerms = includeDefaultTerms;
            return this;
        }

        public Builder includeDefaultRules(boolean includeDefaultRules) {
            this.includeDefaultRules = includeDefaultRules;
            return this;
        }

        public ExtractionOptions build() {
            return new ExtractionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ExtractionOptions{" +
                "contextWindow=" + contextWindow +
                ", caseSensitiveDictionary=" + caseSensitiveDictionary +
                ", includeDefaultPatterns=" + includeDefaultPatterns +
                ", includeDefaultTerms=" + includeDefaultTerms +
                ", includeDefaultRules=" + includeDefaultRules +
                '}';
    }
}
