package com.entity.extraction.similarity;

import java.util.Set;

/**
 * Jaccard similarity over term sets: |intersection| / |union|.
 * String inputs are reduced to key terms by a {@link KeyTermExtractor} before comparison.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private final KeyTermExtractor termExtractor;

    public JaccardSimilarity() {
        this(new KeyTermExtractor());
    }

    public JaccardSimilarity(KeyTermExtractor termExtractor) {
        this.termExtractor = termExtractor;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return compute(termExtractor.extract(s1), termExtractor.extract(s2));
    }

    /**
     * Computes the Jaccard coefficient of two pre-extracted term sets.
     * Returns 0.0 when either set is empty.
     */
    public double compute(Set<String> terms1, Set<String> terms2) {
        if (terms1 == null || terms2 == null || terms1.isEmpty() || terms2.isEmpty()) {
            return 0.0;
        }

        Set<String> smaller = terms1.size() <= terms2.size() ? terms1 : terms2;
        Set<String> larger = smaller == terms1 ? terms2 : terms1;

        int intersectionSize = 0;
        for (String term : smaller) {
            if (larger.contains(term)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = terms1.size() + terms2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    public KeyTermExtractor getTermExtractor() {
        return termExtractor;
    }
}
