package com.example.demo.factfind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response of the generation collaborator. HTML wins over markdown when both are present;
 * {@code response} is the generic text fallback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationResult {
    @JsonProperty("response_html")
    private String responseHtml;

    @JsonProperty("response_markdown")
    private String responseMarkdown;

    @JsonProperty("response")
    private String response;

    /**
     * Template id echoed back by the service
     */
    @JsonProperty("form_type")
    private String formType;

    private String query;

    @JsonProperty("documents_used")
    private Integer documentsUsed;

    private List<Map<String, Object>> documents;

    @JsonIgnore
    public boolean hasHtml() {
        return responseHtml != null && !responseHtml.isEmpty();
    }

    /**
     * Markdown text, falling back to the generic response text
     */
    @JsonIgnore
    public String getMarkdownText() {
        return responseMarkdown != null ? responseMarkdown : response;
    }

    /**
     * Document type label for display, e.g. "cashout_refinance" becomes "cashout refinance"
     */
    @JsonIgnore
    public String getDisplayLabel() {
        if (formType == null || formType.isBlank()) return null;
        return formType.replace('_', ' ');
    }
}
