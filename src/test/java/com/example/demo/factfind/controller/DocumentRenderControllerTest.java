package com.example.demo.factfind.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("local")
public class DocumentRenderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testRenderMarkdownTable() throws Exception {
        String body = "{\"response_markdown\": \"| Item | Amount |\\n|---|---|\\n| Loan | 720000 |\", \"form_type\": \"purchase\"}";

        mockMvc.perform(post("/api/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html").value(containsString("<table>")))
                .andExpect(jsonPath("$.html").value(containsString("<td>Loan</td>")))
                .andExpect(jsonPath("$.empty").doesNotExist());
    }

    @Test
    public void testRenderStripsUnsafeHtml() throws Exception {
        String body = "{\"response_html\": \"<p onclick=\\\"steal()\\\">Hi</p><script>alert(1)</script>\", \"response_markdown\": \"ignored\"}";

        mockMvc.perform(post("/api/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html").value("<p>Hi</p>"))
                .andExpect(jsonPath("$.html").value(not(containsString("script"))));
    }

    @Test
    public void testRenderWithoutContentIsEmpty() throws Exception {
        mockMvc.perform(post("/api/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"form_type\": \"purchase\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html").value(""));
    }
}
