package com.example.demo.factfind.exception;

import lombok.Getter;

/**
 * Raised when the template listing cannot be fetched, parsed or validated.
 * The code is a stable machine-readable identifier (e.g. TEMPLATE_NOT_FOUND,
 * LISTING_UNAVAILABLE); the description is meant for people.
 */
@Getter
public class TemplateLoadingException extends RuntimeException {
    private final String code;
    private final String description;

    public TemplateLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
