package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormSection {
    String title;

    List<FormField> fields;

    public List<FormField> getFields() {
        return fields == null ? List.of() : Collections.unmodifiableList(fields);
    }
}
