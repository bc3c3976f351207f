package com.entity.extraction.core.model;

/**
 * Well-known attribute keys written by extractors, disambiguators and the coreference resolver.
 */
public final class AttributeKeys {

    public static final String PATTERN_NAME = "PatternName";
    public static final String RULE_NAME = "RuleName";
    public static final String FIELD_NAME = "FieldName";

    public static final String IS_PRIMARY_ENTITY = "IsPrimaryEntity";
    public static final String ENTITY_GROUP_SIZE = "EntityGroupSize";
    public static final String DISAMBIGUATION_METHOD = "DisambiguationMethod";
    public static final String CONTEXT_SIMILARITY_SCORE = "ContextSimilarityScore";

    public static final String REFERENCE_TYPE = "ReferenceType";
    public static final String REFERENCE_TARGET = "ReferenceTarget";

    private AttributeKeys() {
        // Utility class
    }
}
