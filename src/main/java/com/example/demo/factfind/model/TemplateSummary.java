package com.example.demo.factfind.model;

import lombok.Value;

@Value
public class TemplateSummary {
    String id;
    String label;

    public static TemplateSummary of(FormTemplate template) {
        return new TemplateSummary(template.getId(), template.getLabel());
    }
}
