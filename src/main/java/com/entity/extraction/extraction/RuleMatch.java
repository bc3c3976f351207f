package com.entity.extraction.extraction;

import java.util.Map;
import java.util.Objects;

/**
 * One hit of an extraction rule: the entity value and its span in the text,
 * plus rule-specific attributes such as {@code Title} or {@code Version}.
 */
public record RuleMatch(String value, int start, int length, Map<String, String> attributes) {

    public RuleMatch {
        Objects.requireNonNull(value, "value is required");
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("start and length must not be negative");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public RuleMatch(String value, int start, int length) {
        this(value, start, length, Map.of());
    }
}
