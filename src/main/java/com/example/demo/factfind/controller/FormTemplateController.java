package com.example.demo.factfind.controller;

import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.exception.TemplateLoadingException;
import com.example.demo.factfind.formula.FormulaEvaluator;
import com.example.demo.factfind.model.CalculatedValue;
import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.payload.PayloadSanitizer;
import com.example.demo.factfind.payload.SubmissionPayload;
import com.example.demo.factfind.service.TemplateRegistry;
import com.example.demo.factfind.value.ValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for the form templates and the stateless form operations
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FormTemplateController {
    private final TemplateRegistry templateRegistry;
    private final FormulaEvaluator formulaEvaluator;
    private final PayloadSanitizer payloadSanitizer;

    /**
     * Loaded templates plus the templates rejected by validation
     *
     * GET /api/form-templates
     */
    @GetMapping("/form-templates")
    public ResponseEntity<?> listTemplates() {
        try {
            return ResponseEntity.ok(templateRegistry.currentCatalog());
        } catch (TemplateLoadingException tle) {
            return ApiErrors.toResponse(tle.getCode(), tle.getDescription());
        }
    }

    @GetMapping("/form-templates/{id}")
    public ResponseEntity<?> getTemplate(@PathVariable("id") String templateId) {
        try {
            return ResponseEntity.ok(templateRegistry.getTemplate(templateId));
        } catch (TemplateLoadingException tle) {
            return ApiErrors.toResponse(tle.getCode(), tle.getDescription());
        }
    }

    /**
     * Evaluate the calculated fields of a template against the posted values
     *
     * POST /api/form-templates/cashout_refinance/calculate
     * { "current_loan_balance": "520000", "cash_out_amount_requested": "200000", "property_value": "850000" }
     */
    @PostMapping("/form-templates/{id}/calculate")
    public ResponseEntity<?> calculate(@PathVariable("id") String templateId,
                                       @RequestBody(required = false) Map<String, Object> values) {
        try {
            FormTemplate template = templateRegistry.getTemplate(templateId);
            Map<String, CalculatedValue> calculated = formulaEvaluator.evaluateAll(template, ValueStore.of(template, values));
            return ResponseEntity.ok(calculated);
        } catch (TemplateLoadingException tle) {
            return ApiErrors.toResponse(tle.getCode(), tle.getDescription());
        } catch (FormValidationException fve) {
            return ApiErrors.toResponse(fve.getCode(), fve.getDescription());
        }
    }

    /**
     * Preview the payload a submission of these values would send
     */
    @PostMapping("/form-templates/{id}/payload")
    public ResponseEntity<?> previewPayload(@PathVariable("id") String templateId,
                                            @RequestBody(required = false) Map<String, Object> values) {
        try {
            FormTemplate template = templateRegistry.getTemplate(templateId);
            ValueStore store = ValueStore.of(template, values);
            Map<String, Object> enriched = new LinkedHashMap<>(store.snapshot());
            formulaEvaluator.evaluateAll(template, store)
                    .forEach((key, calculated) -> enriched.put(key, calculated.getValue()));
            SubmissionPayload payload = payloadSanitizer.sanitize(enriched, template.getFieldKinds());
            log.debug("Payload preview for {}: {}", templateId, payload);
            return ResponseEntity.ok(payload);
        } catch (TemplateLoadingException tle) {
            return ApiErrors.toResponse(tle.getCode(), tle.getDescription());
        } catch (FormValidationException fve) {
            return ApiErrors.toResponse(fve.getCode(), fve.getDescription());
        }
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Fact-find form service is running");
    }
}
