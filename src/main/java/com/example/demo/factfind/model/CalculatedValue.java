package com.example.demo.factfind.model;

import lombok.Value;

/**
 * Value of a calculated field: the fixed-decimal string produced by the formula and
 * the grouped display text (with the field's suffix, when it has one).
 */
@Value
public class CalculatedValue {
    String value;
    String display;
}
