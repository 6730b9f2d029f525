package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A form template as served by the listing collaborator: an id, a display label
 * and ordered sections of fields. Read-only once loaded.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormTemplate {
    String id;

    String label;

    List<FormSection> sections;

    public List<FormSection> getSections() {
        return sections == null ? List.of() : Collections.unmodifiableList(sections);
    }

    /**
     * All top-level fields in section order
     */
    @JsonIgnore
    public List<FormField> getAllFields() {
        return getSections().stream()
                .flatMap(section -> section.getFields().stream())
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public Optional<FormField> findField(String key) {
        if (key == null) return Optional.empty();
        return getAllFields().stream().filter(f -> key.equals(f.getKey())).findFirst();
    }

    /**
     * Field key to kind, in declaration order. Used by the payload sanitizer.
     */
    @JsonIgnore
    public Map<String, FieldKind> getFieldKinds() {
        Map<String, FieldKind> kinds = new LinkedHashMap<>();
        for (FormField field : getAllFields()) {
            kinds.put(field.getKey(), field.getKind());
        }
        return kinds;
    }

    @JsonIgnore
    public List<FormField> getCalculatedFields() {
        return getAllFields().stream().filter(FormField::isCalculated).collect(Collectors.toList());
    }
}
