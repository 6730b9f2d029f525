package com.example.demo.factfind.session;

import com.example.demo.factfind.model.CalculatedValue;
import com.example.demo.factfind.model.TemplateSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Read-only picture of a form session, as returned by the session API.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormSessionView {
    String sessionId;
    FormSessionState state;
    String templateId;
    String templateLabel;
    List<TemplateSummary> templates;
    Map<String, Object> values;
    Map<String, CalculatedValue> calculatedValues;

    /**
     * Chip options still available per chip-driven repeater
     */
    Map<String, List<String>> availableChips;

    String errorMessage;
    String resultHtml;

    /**
     * Document type of the last result, for display
     */
    String resultLabel;
}
