package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a form field as declared by the template's {@code type} attribute.
 */
public enum FieldKind {
    TEXT("text"),
    TEXTAREA("textarea"),
    NUMBER("number"),
    DATE("date"),
    BOOLEAN("boolean"),
    SELECT("select"),
    MULTISELECT("multiselect"),
    REPEATER("repeater"),
    CALCULATED("calculated");

    private final String value;

    FieldKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Kinds this service does not know are entered as free text. A missing or blank
     * type maps to null and is rejected by the template validator.
     */
    @JsonCreator
    public static FieldKind fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (FieldKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return TEXT;
    }

    /**
     * Kinds whose values are held as lists in the value store.
     */
    public boolean isListValued() {
        return this == MULTISELECT || this == REPEATER;
    }
}
