package com.entity.extraction.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces a context snippet to its key terms: lower-cased, punctuation stripped,
 * tokens longer than two characters, common English stop words removed.
 */
public class KeyTermExtractor {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TERM_LENGTH = 3;

    /**
     * Fixed stop-word list for context comparison.
     */
    public static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "this", "that", "with", "for", "from", "was", "were", "will",
            "have", "has", "had", "are", "our", "your", "their", "she", "him", "her", "they",
            "may", "can", "could", "would", "should", "been", "being", "when", "where", "why",
            "how", "what", "who", "which", "such", "some", "very", "just"
    );

    public Set<String> extract(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }

        String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }
}
