package com.example.demo.factfind.exception;

import lombok.Getter;

/**
 * A request against the form cannot be applied: no template selected, unknown field,
 * read-only field or a value of the wrong shape. Recoverable.
 */
@Getter
public class FormValidationException extends RuntimeException {
    public static final String NO_TEMPLATE_SELECTED = "NO_TEMPLATE_SELECTED";
    public static final String UNKNOWN_FIELD = "UNKNOWN_FIELD";
    public static final String READ_ONLY_FIELD = "READ_ONLY_FIELD";
    public static final String INVALID_VALUE = "INVALID_VALUE";
    public static final String UNKNOWN_ITEM = "UNKNOWN_ITEM";

    private final String code;
    private final String description;

    public FormValidationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }
}
