package com.entity.extraction.core.model;

/**
 * Enumeration of entity categories recognized by the extraction pipeline.
 * Closed taxonomy; tenant-specific categories map to {@link #CUSTOM}.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    LOCATION("Location"),
    DATE_TIME("DateTime"),
    MONEY("Money"),
    PERCENTAGE("Percentage"),
    EMAIL("Email"),
    PHONE_NUMBER("PhoneNumber"),
    URL("Url"),
    PRODUCT("Product"),
    TECHNICAL_TERM("TechnicalTerm"),
    JOB_TITLE("JobTitle"),
    SKILL("Skill"),
    CODE_SNIPPET("CodeSnippet"),
    DATABASE_TABLE("DatabaseTable"),
    DATABASE_COLUMN("DatabaseColumn"),
    DATABASE_SCHEMA("DatabaseSchema"),
    NUMBER("Number"),
    MEASUREMENT("Measurement"),
    CUSTOM("Custom"),
    PROJECT("Project"),
    DOCUMENT("Document"),
    API("Api"),
    OTHER("Other");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a type by enum name or label, ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static EntityType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("entity type must not be null or blank");
        }
        for (EntityType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
