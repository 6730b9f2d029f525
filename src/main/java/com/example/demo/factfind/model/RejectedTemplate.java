package com.example.demo.factfind.model;

import lombok.Value;

/**
 * A template excluded from the selectable list because it failed schema validation.
 */
@Value
public class RejectedTemplate {
    String templateId;
    String code;
    String description;
}
