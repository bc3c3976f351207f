package com.entity.extraction.api;

/**
 * A text to recognize, with its source document id and tenant.
 * Options may be null to use the recognizer's defaults.
 */
public record TextUnit(String text, String sourceId, String tenantId, RecognitionOptions options) {

    public TextUnit(String text, String sourceId, String tenantId) {
        this(text, sourceId, tenantId, null);
    }
}
