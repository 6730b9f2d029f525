package com.example.demo.factfind.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sanitized answers sent as {@code form_data}. Never holds an empty string, an empty list
 * or a null value. Serializes as a plain JSON object.
 */
@EqualsAndHashCode
public final class SubmissionPayload {
    private final Map<String, Object> values;

    @JsonCreator
    public SubmissionPayload(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonValue
    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
