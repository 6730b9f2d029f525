package com.example.demo.factfind.exception;

import lombok.Getter;

@Getter
public class TemplateNotFoundException extends TemplateLoadingException {
    public static final String CODE = "TEMPLATE_NOT_FOUND";

    private final String templateId;

    public TemplateNotFoundException(String templateId) {
        super(CODE, "No form template with id '" + templateId + "'");
        this.templateId = templateId;
    }
}
