package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reference to a sub-field of a repeater whose values are summed across all items.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepeaterSource {
    /**
     * Key of the repeater field
     */
    String key;

    /**
     * Key of the sub-field inside each repeater item
     */
    String subKey;
}
