package com.example.demo.factfind.exception;

import lombok.Getter;

/**
 * A template is structurally invalid (duplicate field key, unknown field kind, nested
 * repeater, ...). Fatal for that one template only.
 */
@Getter
public class SchemaValidationException extends TemplateLoadingException {
    private final String templateId;

    public SchemaValidationException(String templateId, String code, String description) {
        super(code, description);
        this.templateId = templateId;
    }
}
