package com.example.demo.factfind.controller;

import com.example.demo.factfind.client.GenerationClient;
import com.example.demo.factfind.exception.GenerationTransportException;
import com.example.demo.factfind.model.GenerationRequest;
import com.example.demo.factfind.model.GenerationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a form session through the REST API with the generation service mocked out.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("local")
public class FormSessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private GenerationClient generationClient;

    private String sessionId;

    @BeforeEach
    public void openSession() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").isNotEmpty())
                .andReturn();
        JsonNode view = objectMapper.readTree(created.getResponse().getContentAsString());
        sessionId = view.get("sessionId").asText();

        mockMvc.perform(put("/api/sessions/{id}/template", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": \"lvr_check\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("TEMPLATE_ACTIVE"))
                .andExpect(jsonPath("$.templateId").value("lvr_check"))
                .andExpect(jsonPath("$.templates", hasSize(2)));
    }

    @Test
    public void testEditingUpdatesValuesAndCalculatedFields() throws Exception {
        setField("loan_amount", "\"720000\"");
        mockMvc.perform(put("/api/sessions/{id}/fields/{key}", sessionId, "property_value")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 850000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.loan_amount").value("720000"))
                .andExpect(jsonPath("$.values.property_value").value("850000"))
                .andExpect(jsonPath("$.calculatedValues.lvr.value").value("84.71"))
                .andExpect(jsonPath("$.calculatedValues.lvr.display").value("84.71 %"));
    }

    @Test
    public void testRepeaterItemsAndCount() throws Exception {
        mockMvc.perform(put("/api/sessions/{id}/repeaters/{key}/count", sessionId, "other_incomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.other_incomes", hasSize(3)));

        mockMvc.perform(put("/api/sessions/{id}/repeaters/{key}/items/{index}/{sub}", sessionId, "other_incomes", 2, "amount")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"1500\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.other_incomes[2].amount").value("1500"))
                .andExpect(jsonPath("$.calculatedValues.total_income.value").value("1500.00"));

        mockMvc.perform(put("/api/sessions/{id}/repeaters/{key}/items/{index}/{sub}", sessionId, "other_incomes", 7, "amount")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_ITEM"));
    }

    @Test
    public void testChipsAndSelections() throws Exception {
        mockMvc.perform(post("/api/sessions/{id}/repeaters/{key}/chips/{type}", sessionId, "stages", "Frame"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.stages[0].type").value("Frame"))
                .andExpect(jsonPath("$.availableChips.stages", contains("Slab", "Lock-Up")));

        mockMvc.perform(delete("/api/sessions/{id}/repeaters/{key}/chips/{type}", sessionId, "stages", "Frame"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.stages", hasSize(0)));

        mockMvc.perform(post("/api/sessions/{id}/selections/{key}/{option}", sessionId, "features", "Redraw"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/sessions/{id}/selections/{key}/{option}", sessionId, "features", "Fixed Rate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.features", contains("Redraw", "Fixed Rate")));
        mockMvc.perform(delete("/api/sessions/{id}/selections/{key}/{option}", sessionId, "features", "Redraw"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.features", contains("Fixed Rate")));
        mockMvc.perform(delete("/api/sessions/{id}/selections/{key}", sessionId, "features"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.features", hasSize(0)));
    }

    @Test
    public void testEditErrorsAreReportedWithCodes() throws Exception {
        mockMvc.perform(put("/api/sessions/{id}/fields/{key}", sessionId, "lvr")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"50\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("READ_ONLY_FIELD"));

        mockMvc.perform(put("/api/sessions/{id}/fields/{key}", sessionId, "nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_FIELD"));

        mockMvc.perform(put("/api/sessions/{id}/template", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": \"broken_kind\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TEMPLATE_NOT_FOUND"));
    }

    @Test
    public void testSubmitRendersResult() throws Exception {
        when(generationClient.generate(any())).thenReturn(CompletableFuture.completedFuture(
                GenerationResult.builder()
                        .responseMarkdown("## Assessment\n\nLVR is **84.71%**")
                        .formType("lvr_check")
                        .build()));
        setField("loan_amount", "\"720000\"");
        setField("property_value", "\"850000\"");

        mockMvc.perform(post("/api/sessions/{id}/submit", sessionId).param("wait", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RESULT_READY"))
                .andExpect(jsonPath("$.resultHtml").value(containsString("<h2>Assessment</h2>")))
                .andExpect(jsonPath("$.resultHtml").value(containsString("<strong>84.71%</strong>")))
                .andExpect(jsonPath("$.resultLabel").value("lvr check"));

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationClient).generate(captor.capture());
        GenerationRequest request = captor.getValue();
        assertEquals("lvr_check", request.getFormType());
        assertEquals(84.71d, request.getFormData().get("lvr"));
        assertEquals("720000", request.getFormData().get("loan_amount"));
    }

    @Test
    public void testFailedSubmitKeepsValues() throws Exception {
        when(generationClient.generate(any())).thenReturn(CompletableFuture.failedFuture(
                new GenerationTransportException("GENERATION_UNREACHABLE", "Connection refused", null, null)));
        setField("loan_amount", "\"720000\"");

        mockMvc.perform(post("/api/sessions/{id}/submit", sessionId).param("wait", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("SUBMIT_FAILED"))
                .andExpect(jsonPath("$.errorMessage").value("Something went wrong while contacting the assistant."))
                .andExpect(jsonPath("$.values.loan_amount").value("720000"))
                .andExpect(jsonPath("$.resultHtml").doesNotExist());
    }

    @Test
    public void testAbortWhileSubmitting() throws Exception {
        CompletableFuture<GenerationResult> pending = new CompletableFuture<>();
        when(generationClient.generate(any())).thenReturn(pending);

        mockMvc.perform(post("/api/sessions/{id}/submit", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("SUBMITTING"));

        mockMvc.perform(post("/api/sessions/{id}/abort", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("TEMPLATE_ACTIVE"));
        assertTrue(pending.isCancelled());
    }

    @Test
    public void testDisposeAndUnknownSession() throws Exception {
        mockMvc.perform(delete("/api/sessions/{id}", sessionId))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/sessions/{id}", sessionId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
        mockMvc.perform(delete("/api/sessions/{id}", sessionId))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/sessions/{id}/submit", "missing"))
                .andExpect(status().isNotFound());
    }

    private void setField(String key, String jsonValue) throws Exception {
        mockMvc.perform(put("/api/sessions/{id}/fields/{key}", sessionId, key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": " + jsonValue + "}"))
                .andExpect(status().isOk());
    }
}
