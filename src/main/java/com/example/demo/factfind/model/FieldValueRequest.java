package com.example.demo.factfind.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a field update. The value shape depends on the field kind: a string, a boolean,
 * a list of strings (multiselect) or a list of item objects (repeater).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldValueRequest {
    private Object value;
}
