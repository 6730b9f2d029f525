package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FormulaType {
    SUM("sum"),
    RATIO("ratio");

    private final String value;

    FormulaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // anything that is not a ratio is evaluated as a sum
    @JsonCreator
    public static FormulaType fromValue(String value) {
        if (value != null && RATIO.value.equalsIgnoreCase(value.trim())) {
            return RATIO;
        }
        return SUM;
    }
}
