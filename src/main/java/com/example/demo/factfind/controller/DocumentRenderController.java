package com.example.demo.factfind.controller;

import com.example.demo.factfind.model.GenerationResult;
import com.example.demo.factfind.render.OutputRenderer;
import com.example.demo.factfind.render.SafeHtml;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Renders a generation result to allow-listed HTML.
 *
 * POST /api/render
 * { "response_markdown": "## Recommendation\n..." }
 */
@Slf4j
@RestController
@RequestMapping("/api/render")
@RequiredArgsConstructor
public class DocumentRenderController {
    private final OutputRenderer outputRenderer;

    @PostMapping
    public ResponseEntity<SafeHtml> render(@RequestBody GenerationResult result) {
        log.info("Received render request for form type: {}", result.getFormType());
        return ResponseEntity.ok(outputRenderer.render(result));
    }
}
