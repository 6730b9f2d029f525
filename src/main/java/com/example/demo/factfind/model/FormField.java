package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One input of a form template. Which attributes apply depends on {@link #kind}:
 * options/placeholder for selects, min/max/step for numbers, min/max item counts and
 * sub-fields for repeaters, formula/suffix for calculated fields.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormField {
    /**
     * Sub-field key that turns a repeater into a chip-driven, type-keyed collection
     */
    public static final String TYPE_SUBFIELD_KEY = "type";

    public static final int DEFAULT_REPEATER_MAX = 10;

    String key;

    String label;

    @JsonProperty("type")
    FieldKind kind;

    String placeholder;

    List<String> options;

    /**
     * Lower bound for numbers, minimum item count for repeaters
     */
    Double min;

    /**
     * Upper bound for numbers, maximum item count for repeaters
     */
    Double max;

    String step;

    @JsonProperty("number_mode")
    String numberMode;

    Integer rows;

    String itemLabel;

    /**
     * Sub-fields of a repeater item
     */
    List<FormField> fields;

    Formula formula;

    String suffix;

    /**
     * Visibility hint carried through for clients; not interpreted here
     */
    @JsonProperty("show_when")
    Map<String, Object> showWhen;

    public List<String> getOptions() {
        return options == null ? List.of() : Collections.unmodifiableList(options);
    }

    public List<FormField> getFields() {
        return fields == null ? List.of() : Collections.unmodifiableList(fields);
    }

    public Map<String, Object> getShowWhen() {
        return showWhen == null ? null : Collections.unmodifiableMap(showWhen);
    }

    @JsonIgnore
    public boolean isRepeater() {
        return kind == FieldKind.REPEATER;
    }

    @JsonIgnore
    public boolean isCalculated() {
        return kind == FieldKind.CALCULATED;
    }

    /**
     * The {@code type} sub-field of a repeater when it carries options. Its presence
     * switches the repeater to chip mode.
     */
    @JsonIgnore
    public Optional<FormField> getTypeSubField() {
        if (!isRepeater()) return Optional.empty();
        return getFields().stream()
                .filter(f -> TYPE_SUBFIELD_KEY.equals(f.getKey()) && !f.getOptions().isEmpty())
                .findFirst();
    }

    @JsonIgnore
    public Optional<FormField> findSubField(String subKey) {
        return getFields().stream().filter(f -> f.getKey() != null && f.getKey().equals(subKey)).findFirst();
    }

    @JsonIgnore
    public int getMaxItems() {
        return max == null ? DEFAULT_REPEATER_MAX : max.intValue();
    }

    @JsonIgnore
    public int getMinItems() {
        return min == null ? 0 : Math.max(0, min.intValue());
    }
}
