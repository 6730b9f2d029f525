package com.example.demo.factfind.service;

import com.example.demo.factfind.exception.SchemaValidationException;
import com.example.demo.factfind.model.FieldKind;
import com.example.demo.factfind.model.FormField;
import com.example.demo.factfind.model.FormSection;
import com.example.demo.factfind.model.FormTemplate;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks applied to each template as it is loaded. A failure rejects only the
 * template concerned.
 */
@Component
public class TemplateValidator {
    public static final String MISSING_TEMPLATE_ID = "MISSING_TEMPLATE_ID";
    public static final String MISSING_FIELD_KEY = "MISSING_FIELD_KEY";
    public static final String DUPLICATE_FIELD_KEY = "DUPLICATE_FIELD_KEY";
    public static final String MISSING_FIELD_KIND = "MISSING_FIELD_KIND";
    public static final String NESTED_REPEATER = "NESTED_REPEATER";
    public static final String CALCULATED_SUBFIELD = "CALCULATED_SUBFIELD";
    public static final String INVALID_BOUNDS = "INVALID_BOUNDS";

    public void validate(FormTemplate template) {
        String id = template.getId();
        if (id == null || id.isBlank()) {
            throw new SchemaValidationException(id, MISSING_TEMPLATE_ID, "Template has no id");
        }
        Set<String> keys = new HashSet<>();
        for (FormSection section : template.getSections()) {
            for (FormField field : section.getFields()) {
                validateField(id, field, keys, false);
            }
        }
    }

    private void validateField(String templateId, FormField field, Set<String> seenKeys, boolean insideRepeater) {
        String key = field.getKey();
        if (key == null || key.isBlank()) {
            throw new SchemaValidationException(templateId, MISSING_FIELD_KEY,
                    "A field labelled '" + field.getLabel() + "' has no key");
        }
        if (!seenKeys.add(key)) {
            throw new SchemaValidationException(templateId, DUPLICATE_FIELD_KEY,
                    "Field key '" + key + "' is declared more than once");
        }
        if (field.getKind() == null) {
            throw new SchemaValidationException(templateId, MISSING_FIELD_KIND,
                    "Field '" + key + "' has no type");
        }
        if (field.getMin() != null && field.getMax() != null && field.getMin() > field.getMax()) {
            throw new SchemaValidationException(templateId, INVALID_BOUNDS,
                    "Field '" + key + "' has min greater than max");
        }
        if (insideRepeater) {
            if (field.getKind() == FieldKind.REPEATER) {
                throw new SchemaValidationException(templateId, NESTED_REPEATER,
                        "Repeater sub-field '" + key + "' cannot itself be a repeater");
            }
            if (field.getKind() == FieldKind.CALCULATED) {
                throw new SchemaValidationException(templateId, CALCULATED_SUBFIELD,
                        "Repeater sub-field '" + key + "' cannot be calculated");
            }
            return;
        }
        if (field.isRepeater()) {
            Set<String> subKeys = new HashSet<>();
            List<FormField> subFields = field.getFields();
            for (FormField sub : subFields) {
                validateField(templateId, sub, subKeys, true);
            }
        }
    }
}
