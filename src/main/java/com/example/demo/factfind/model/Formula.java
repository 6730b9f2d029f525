package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * Formula attached to a calculated field.
 *
 * <pre>
 * formula:
 *   type: ratio
 *   numerator_fields: [loan_amount]
 *   denominator_field: property_value
 *   multiplier: 100
 *   decimals: 2
 * </pre>
 *
 * A formula without a type is a sum of {@code fields} plus every
 * {@code repeaters} sub-field across the repeater's items.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Formula {
    public static final int DEFAULT_DECIMALS = 2;

    @JsonProperty("type")
    FormulaType type;

    /**
     * Field keys added by a sum formula
     */
    List<String> fields;

    /**
     * Repeater sub-fields added by a sum formula
     */
    List<RepeaterSource> repeaters;

    @JsonProperty("numerator_fields")
    List<String> numeratorFields;

    @JsonProperty("denominator_field")
    String denominatorField;

    /**
     * Applied to a ratio; null or 0 means 1
     */
    Double multiplier;

    /**
     * Number of fraction digits in the formatted result; null means 2
     */
    Integer decimals;

    public List<String> getFields() {
        return fields == null ? List.of() : Collections.unmodifiableList(fields);
    }

    public List<RepeaterSource> getRepeaters() {
        return repeaters == null ? List.of() : Collections.unmodifiableList(repeaters);
    }

    public List<String> getNumeratorFields() {
        return numeratorFields == null ? List.of() : Collections.unmodifiableList(numeratorFields);
    }

    @JsonIgnore
    public FormulaType getEffectiveType() {
        return type == null ? FormulaType.SUM : type;
    }

    @JsonIgnore
    public int getEffectiveDecimals() {
        if (decimals == null) return DEFAULT_DECIMALS;
        return Math.max(0, Math.min(decimals, 20));
    }

    @JsonIgnore
    public double getEffectiveMultiplier() {
        return multiplier == null || multiplier == 0d ? 1d : multiplier;
    }
}
