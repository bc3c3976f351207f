package com.entity.extraction.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Pattern and term tables read from JSON by {@link ExtractionTablesLoader}.
 *
 * <pre>
 * {
 *   "patterns": [{"type": "Email", "name": "CorporateEmail", "regex": "...", "caseInsensitive": true}],
 *   "terms":    [{"type": "Organization", "confidence": 0.9, "values": ["Acme", "Globex"]}]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionTables(List<PatternEntry> patterns, List<TermEntry> terms) {

    public ExtractionTables {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternEntry(String type, String name, String regex, boolean caseInsensitive) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TermEntry(String type, Double confidence, List<String> values) {
    }
}
