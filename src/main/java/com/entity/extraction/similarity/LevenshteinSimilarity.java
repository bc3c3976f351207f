package com.entity.extraction.similarity;

import java.util.Locale;

/**
 * Normalized Levenshtein similarity: {@code 1 - (edit_distance / max_length)}.
 * By default both inputs are lower-cased first, so names differing only in case score 1.0.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    private final boolean ignoreCase;

    public LevenshteinSimilarity() {
        this(true);
    }

    public LevenshteinSimilarity(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = ignoreCase ? s1.toLowerCase(Locale.ROOT) : s1;
        String b = ignoreCase ? s2.toLowerCase(Locale.ROOT) : s2;
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) distance(a, b) / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    /**
     * Computes the Levenshtein edit distance between two strings.
     * Wagner-Fischer with two rolling rows sized to the shorter input.
     */
    public static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            char c2 = s2.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c2 ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
