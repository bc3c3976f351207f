package com.entity.extraction.core.model;

import java.util.Objects;

/**
 * Typed value stored in an entity's attribute map.
 * The family is closed: text, number, flag, or a reference to another entity.
 */
public sealed interface AttributeValue permits AttributeValue.Text, AttributeValue.Number,
        AttributeValue.Flag, AttributeValue.EntityRef {

    /**
     * Returns the raw Java value (String, Double, Boolean, or the referenced entity id).
     */
    Object raw();

    static AttributeValue text(String value) {
        return new Text(value);
    }

    static AttributeValue number(double value) {
        return new Number(value);
    }

    static AttributeValue flag(boolean value) {
        return new Flag(value);
    }

    static AttributeValue entityRef(String entityId) {
        return new EntityRef(entityId);
    }

    record Text(String value) implements AttributeValue {
        public Text {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Number(double value) implements AttributeValue {
        @Override
        public Object raw() {
            return value;
        }

        public int intValue() {
            return (int) value;
        }

        @Override
        public String toString() {
            return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
        }
    }

    record Flag(boolean value) implements AttributeValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record EntityRef(String entityId) implements AttributeValue {
        public EntityRef {
            Objects.requireNonNull(entityId, "entityId is required");
        }

        @Override
        public Object raw() {
            return entityId;
        }

        @Override
        public String toString() {
            return "ref:" + entityId;
        }
    }
}
