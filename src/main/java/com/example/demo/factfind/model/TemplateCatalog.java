package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * The set of templates loaded for the process, plus the ones that were rejected.
 */
@Value
public class TemplateCatalog {
    List<FormTemplate> templates;
    List<RejectedTemplate> rejected;

    public TemplateCatalog(List<FormTemplate> templates, List<RejectedTemplate> rejected) {
        this.templates = List.copyOf(templates);
        this.rejected = List.copyOf(rejected);
    }

    public Optional<FormTemplate> find(String templateId) {
        if (templateId == null) return Optional.empty();
        return templates.stream().filter(t -> templateId.equals(t.getId())).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return templates.isEmpty();
    }
}
