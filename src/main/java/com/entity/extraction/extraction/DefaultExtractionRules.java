package com.entity.extraction.extraction;

import com.entity.extraction.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in heuristic rules for the rule-based extractor.
 */
public final class DefaultExtractionRules {

    private static final Pattern TITLED_PERSON = Pattern.compile(
            "\\b(Mr\\.|Mrs\\.|Ms\\.|Dr\\.|Prof\\.|Sir|Madam)\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+){0,2})\\b");

    // (?!\w) instead of \b so a suffix ending in '.' still matches before a space.
    private static final Pattern SUFFIXED_ORGANIZATION = Pattern.compile(
            "\\b([A-Z][a-zA-Z0-9]+(?:\\s+[A-Z][a-zA-Z0-9]+){0,5})\\s+"
                    + "(Inc\\.|Corp\\.|LLC|Ltd\\.|Limited|Corporation|Company|GmbH|Co\\.|Group|Holdings)(?!\\w)");

    private static final Pattern PREFIXED_LOCATION = Pattern.compile(
            "\\b(in|at|from|to|near|around)\\s+([A-Z][a-zA-Z]+(?:\\s+[A-Z][a-zA-Z]+){0,2})\\b");

    private static final Pattern VERSIONED_PRODUCT = Pattern.compile(
            "\\b([A-Z][a-zA-Z0-9]+(?:\\s+[A-Z][a-zA-Z0-9]+){0,3})\\s+(v?[0-9]+(?:\\.[0-9]+){1,3})\\b");

    private static final Pattern API_ENDPOINT = Pattern.compile(
            "\\b(GET|POST|PUT|DELETE|PATCH)\\s+(/api/[a-zA-Z0-9/\\-_{}]+)");

    private static final Pattern CAPITALIZED_NAME = Pattern.compile(
            "\\b[A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+){1,3}\\b");
    private static final Pattern CAPITALIZED_WORD = Pattern.compile("[A-Z][a-z]+");
    private static final Pattern PRECEDING_TITLE = Pattern.compile(
            "(?:Mr\\.|Mrs\\.|Ms\\.|Dr\\.|Prof\\.|Sir|Madam)\\s+$");
    private static final Pattern PRECEDING_PREPOSITION = Pattern.compile(
            "\\b(?:in|at|from|to|near|around)\\s+$");
    private static final Pattern FOLLOWING_WORD = Pattern.compile("[ \\t]+([A-Za-z]+)");

    private static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
            "Inc", "Corp", "LLC", "Ltd", "Limited", "Corporation", "Company",
            "GmbH", "Co", "Group", "Holdings");

    // Capitalized words that open sentences rather than names.
    private static final Set<String> LEADING_WORDS = Set.of(
            "The", "A", "An", "This", "That", "These", "Those", "Our", "Their", "His", "Her",
            "Its", "My", "Your", "When", "Then", "After", "Before", "Yesterday", "Today",
            "Tomorrow", "Meanwhile", "However", "And", "But", "If", "In", "At", "On", "From",
            "To", "Near", "Around", "Sir", "Madam");

    private DefaultExtractionRules() {
        // Utility class
    }

    public static List<ExtractionRule> all() {
        return List.of(
                personNameWithTitle(),
                organizationWithSuffix(),
                locationWithPrefix(),
                productWithVersion(),
                apiEndpoint(),
                capitalizedPersonName());
    }

    /**
     * "Dr. Jane Doe": a courtesy title followed by one to three capitalized words.
     */
    public static ExtractionRule personNameWithTitle() {
        return ExtractionRule.builder()
                .name("PersonNameWithTitle")
                .entityType(EntityType.PERSON)
                .confidence(0.85)
                .matcher(regex(TITLED_PERSON, m -> new RuleMatch(
                        m.group(1) + " " + m.group(2), m.start(), m.end() - m.start(),
                        Map.of("Title", m.group(1), "Name", m.group(2)))))
                .build();
    }

    /**
     * "Acme Widgets Inc.": capitalized words followed by a legal-entity suffix.
     */
    public static ExtractionRule organizationWithSuffix() {
        return ExtractionRule.builder()
                .name("OrganizationWithSuffix")
                .entityType(EntityType.ORGANIZATION)
                .confidence(0.9)
                .matcher(regex(SUFFIXED_ORGANIZATION, m -> new RuleMatch(
                        m.group(1) + " " + m.group(2), m.start(), m.end() - m.start(),
                        Map.of("Name", m.group(1), "Suffix", m.group(2)))))
                .build();
    }

    /**
     * "in New York": the span covers the location only, not the preposition.
     */
    public static ExtractionRule locationWithPrefix() {
        return ExtractionRule.builder()
                .name("LocationWithPrefix")
                .entityType(EntityType.LOCATION)
                .confidence(0.6)
                .matcher(regex(PREFIXED_LOCATION, m -> new RuleMatch(
                        m.group(2), m.start(2), m.group(2).length(),
                        Map.of("Prefix", m.group(1)))))
                .build();
    }

    public static ExtractionRule productWithVersion() {
        return ExtractionRule.builder()
                .name("ProductWithVersion")
                .entityType(EntityType.PRODUCT)
                .confidence(0.85)
                .matcher(regex(VERSIONED_PRODUCT, m -> new RuleMatch(
                        m.group(1) + " " + m.group(2), m.start(), m.end() - m.start(),
                        Map.of("ProductName", m.group(1), "Version", m.group(2)))))
                .build();
    }

    public static ExtractionRule apiEndpoint() {
        return ExtractionRule.builder()
                .name("ApiEndpoint")
                .entityType(EntityType.API)
                .confidence(0.9)
                .matcher(regex(API_ENDPOINT, m -> new RuleMatch(
                        m.group(1) + " " + m.group(2), m.start(), m.end() - m.start(),
                        Map.of("Method", m.group(1), "Endpoint", m.group(2)))))
                .build();
    }

    /**
     * "John Smith": two or three capitalized words. Sentence-opening words are
     * dropped from the front; candidates introduced by a title or a location
     * preposition, or ending in a legal-entity suffix, are left to the other rules.
     */
    public static ExtractionRule capitalizedPersonName() {
        return ExtractionRule.builder()
                .name("CapitalizedPersonName")
                .entityType(EntityType.PERSON)
                .confidence(0.6)
                .matcher(DefaultExtractionRules::matchCapitalizedNames)
                .build();
    }

    private static List<RuleMatch> matchCapitalizedNames(String text) {
        List<RuleMatch> results = new ArrayList<>();
        Matcher candidates = CAPITALIZED_NAME.matcher(text);
        while (candidates.find()) {
            List<int[]> words = new ArrayList<>();
            Matcher word = CAPITALIZED_WORD.matcher(text).region(candidates.start(), candidates.end());
            while (word.find()) {
                words.add(new int[]{word.start(), word.end()});
            }

            int first = 0;
            while (first < words.size() && LEADING_WORDS.contains(wordAt(text, words.get(first)))) {
                first++;
            }
            if (words.size() - first < 2 || words.size() - first > 3) {
                continue;
            }
            int start = words.get(first)[0];
            int end = words.get(words.size() - 1)[1];

            if (ORGANIZATION_SUFFIXES.contains(wordAt(text, words.get(words.size() - 1)))
                    || followedBySuffix(text, end)
                    || (first == 0 && precededBy(PRECEDING_TITLE, text, start))
                    || (first == 0 && precededBy(PRECEDING_PREPOSITION, text, start))) {
                continue;
            }
            results.add(new RuleMatch(text.substring(start, end), start, end - start));
        }
        return results;
    }

    private static String wordAt(String text, int[] bounds) {
        return text.substring(bounds[0], bounds[1]);
    }

    private static boolean followedBySuffix(String text, int end) {
        Matcher next = FOLLOWING_WORD.matcher(text).region(end, text.length());
        return next.lookingAt() && ORGANIZATION_SUFFIXES.contains(next.group(1));
    }

    private static boolean precededBy(Pattern pattern, String text, int start) {
        Matcher m = pattern.matcher(text)
                .region(Math.max(0, start - 20), start)
                .useTransparentBounds(true);
        return m.find();
    }

    private static ExtractionRule.Matcher regex(Pattern pattern, Function<Matcher, RuleMatch> toMatch) {
        return text -> {
            List<RuleMatch> results = new ArrayList<>();
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                results.add(toMatch.apply(m));
            }
            return results;
        };
    }
}
