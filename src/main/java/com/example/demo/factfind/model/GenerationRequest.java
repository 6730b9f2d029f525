package com.example.demo.factfind.model;

import com.example.demo.factfind.payload.SubmissionPayload;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body sent to the generation collaborator:
 * <pre>
 * { "form_type": "purchase", "form_data": { ... }, "applicants": [] }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {
    /**
     * Id of the template the payload was captured with
     */
    @JsonProperty("form_type")
    private String formType;

    @JsonProperty("form_data")
    private SubmissionPayload formData;

    /**
     * Always sent empty; applicant details travel inside form_data
     */
    @Builder.Default
    private List<Object> applicants = new ArrayList<>();
}
