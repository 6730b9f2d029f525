package com.example.demo.factfind;

import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.model.TemplateListing;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Templates from src/test/resources/templates/test-form-templates.yaml, parsed without
 * validation.
 */
public final class FormTemplateFixtures {
    public static final String LISTING = "templates/test-form-templates.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private FormTemplateFixtures() {
    }

    public static TemplateListing listing() {
        try (InputStream is = FormTemplateFixtures.class.getClassLoader().getResourceAsStream(LISTING)) {
            return YAML.readValue(is, TemplateListing.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FormTemplate template(String id) {
        return listing().getForms().stream()
                .filter(t -> id.equals(t.getId()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No fixture template " + id));
    }

    public static FormTemplate lvrCheck() {
        return template("lvr_check");
    }
}
