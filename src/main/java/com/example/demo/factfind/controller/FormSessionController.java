package com.example.demo.factfind.controller;

import com.example.demo.factfind.config.FactFindProperties;
import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.exception.SessionNotFoundException;
import com.example.demo.factfind.exception.TemplateLoadingException;
import com.example.demo.factfind.model.FieldValueRequest;
import com.example.demo.factfind.model.ItemCountRequest;
import com.example.demo.factfind.model.TemplateSelectionRequest;
import com.example.demo.factfind.service.FormSessionService;
import com.example.demo.factfind.session.FormSession;
import com.example.demo.factfind.session.FormSessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * REST API for interactive form sessions.
 *
 * POST   /api/sessions                                          open a session
 * GET    /api/sessions/{id}                                     view it
 * PUT    /api/sessions/{id}/template                            { "templateId": "purchase" }
 * PUT    /api/sessions/{id}/fields/{key}                        { "value": ... }
 * PUT    /api/sessions/{id}/repeaters/{key}/items/{index}/{sub} { "value": ... }
 * POST   /api/sessions/{id}/repeaters/{key}/chips/{type}
 * DELETE /api/sessions/{id}/repeaters/{key}/chips/{type}
 * PUT    /api/sessions/{id}/repeaters/{key}/count               { "count": 2 }
 * POST   /api/sessions/{id}/selections/{key}/{option}
 * DELETE /api/sessions/{id}/selections/{key}/{option}
 * DELETE /api/sessions/{id}/selections/{key}
 * POST   /api/sessions/{id}/submit[?wait=true]
 * POST   /api/sessions/{id}/abort
 * DELETE /api/sessions/{id}
 *
 * Every call except DELETE returns the session view.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class FormSessionController {
    private final FormSessionService sessionService;
    private final FactFindProperties properties;

    @PostMapping
    public ResponseEntity<?> create() {
        FormSession session = sessionService.create();
        return new ResponseEntity<>(session.view(), HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> view(@PathVariable("id") String sessionId) {
        return apply(sessionId, session -> { });
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> dispose(@PathVariable("id") String sessionId) {
        if (!sessionService.dispose(sessionId)) {
            return ApiErrors.toResponse(SessionNotFoundException.CODE, "No form session with id '" + sessionId + "'");
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/template")
    public ResponseEntity<?> selectTemplate(@PathVariable("id") String sessionId,
                                            @RequestBody TemplateSelectionRequest request) {
        log.info("Session {} selecting template {}", sessionId, request.getTemplateId());
        return apply(sessionId, session -> session.selectTemplate(request.getTemplateId()));
    }

    @PutMapping("/{id}/fields/{key}")
    public ResponseEntity<?> setField(@PathVariable("id") String sessionId,
                                      @PathVariable("key") String key,
                                      @RequestBody FieldValueRequest request) {
        return apply(sessionId, session -> session.setField(key, request.getValue()));
    }

    @PutMapping("/{id}/repeaters/{key}/items/{index}/{subKey}")
    public ResponseEntity<?> updateItem(@PathVariable("id") String sessionId,
                                        @PathVariable("key") String key,
                                        @PathVariable("index") int index,
                                        @PathVariable("subKey") String subKey,
                                        @RequestBody FieldValueRequest request) {
        return apply(sessionId, session -> session.updateItem(key, index, subKey, request.getValue()));
    }

    @PostMapping("/{id}/repeaters/{key}/chips/{type}")
    public ResponseEntity<?> addChip(@PathVariable("id") String sessionId,
                                     @PathVariable("key") String key,
                                     @PathVariable("type") String type) {
        return apply(sessionId, session -> session.addChip(key, type));
    }

    @DeleteMapping("/{id}/repeaters/{key}/chips/{type}")
    public ResponseEntity<?> removeChip(@PathVariable("id") String sessionId,
                                        @PathVariable("key") String key,
                                        @PathVariable("type") String type) {
        return apply(sessionId, session -> session.removeChip(key, type));
    }

    @PutMapping("/{id}/repeaters/{key}/count")
    public ResponseEntity<?> setItemCount(@PathVariable("id") String sessionId,
                                          @PathVariable("key") String key,
                                          @RequestBody ItemCountRequest request) {
        return apply(sessionId, session -> session.setItemCount(key, request.getCount()));
    }

    @PostMapping("/{id}/selections/{key}/{option}")
    public ResponseEntity<?> addSelection(@PathVariable("id") String sessionId,
                                          @PathVariable("key") String key,
                                          @PathVariable("option") String option) {
        return apply(sessionId, session -> session.addSelection(key, option));
    }

    @DeleteMapping("/{id}/selections/{key}/{option}")
    public ResponseEntity<?> removeSelection(@PathVariable("id") String sessionId,
                                             @PathVariable("key") String key,
                                             @PathVariable("option") String option) {
        return apply(sessionId, session -> session.removeSelection(key, option));
    }

    @DeleteMapping("/{id}/selections/{key}")
    public ResponseEntity<?> clearSelections(@PathVariable("id") String sessionId,
                                             @PathVariable("key") String key) {
        return apply(sessionId, session -> session.clearSelections(key));
    }

    /**
     * Submit the form. Returns at once with the session in SUBMITTING unless {@code wait}
     * is set, in which case the call blocks until the outcome is known or the configured
     * wait timeout elapses.
     */
    @PostMapping("/{id}/submit")
    public ResponseEntity<?> submit(@PathVariable("id") String sessionId,
                                    @RequestParam(name = "wait", defaultValue = "false") boolean wait) {
        try {
            FormSession session = sessionService.get(sessionId);
            CompletableFuture<FormSessionState> outcome = session.submit();
            if (wait) {
                awaitOutcome(sessionId, outcome);
            }
            return ResponseEntity.ok(session.view());
        } catch (SessionNotFoundException snf) {
            return ApiErrors.toResponse(snf.getCode(), snf.getDescription());
        }
    }

    @PostMapping("/{id}/abort")
    public ResponseEntity<?> abort(@PathVariable("id") String sessionId) {
        return apply(sessionId, FormSession::abortSubmission);
    }

    private void awaitOutcome(String sessionId, CompletableFuture<FormSessionState> outcome) {
        long timeoutMs = properties.getSession().getSubmitWaitTimeout().toMillis();
        try {
            FormSessionState state = outcome.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Session {} submission finished in state {}", sessionId, state);
        } catch (TimeoutException e) {
            log.warn("Session {} submission still running after {} ms", sessionId, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Session {} submission outcome failed", sessionId, e.getCause());
        }
    }

    private ResponseEntity<?> apply(String sessionId, Consumer<FormSession> action) {
        try {
            FormSession session = sessionService.get(sessionId);
            action.accept(session);
            return ResponseEntity.ok(session.view());
        } catch (SessionNotFoundException snf) {
            return ApiErrors.toResponse(snf.getCode(), snf.getDescription());
        } catch (FormValidationException fve) {
            return ApiErrors.toResponse(fve.getCode(), fve.getDescription());
        } catch (TemplateLoadingException tle) {
            return ApiErrors.toResponse(tle.getCode(), tle.getDescription());
        }
    }
}
