package com.example.demo.factfind.service;

import com.example.demo.factfind.client.GenerationClient;
import com.example.demo.factfind.config.FactFindProperties;
import com.example.demo.factfind.exception.SessionNotFoundException;
import com.example.demo.factfind.formula.FormulaEvaluator;
import com.example.demo.factfind.payload.PayloadSanitizer;
import com.example.demo.factfind.render.OutputRenderer;
import com.example.demo.factfind.session.FormSession;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * In-memory store of live form sessions, keyed by a random id.
 *
 * <p>Sessions not touched for {@code factfind.session.idle-timeout} expire, and the oldest
 * are dropped once {@code factfind.session.max-sessions} is exceeded. Every removal,
 * explicit or not, disposes the session so that its in-flight calls are cancelled.
 */
@Slf4j
@Service
public class FormSessionService {
    private final TemplateCatalogSource catalogSource;
    private final GenerationClient generationClient;
    private final FormulaEvaluator formulaEvaluator;
    private final PayloadSanitizer payloadSanitizer;
    private final OutputRenderer outputRenderer;
    private final FactFindProperties properties;
    private final Cache<String, FormSession> sessions;

    @Autowired
    public FormSessionService(TemplateCatalogSource catalogSource, GenerationClient generationClient,
                              FormulaEvaluator formulaEvaluator, PayloadSanitizer payloadSanitizer,
                              OutputRenderer outputRenderer, FactFindProperties properties) {
        this(catalogSource, generationClient, formulaEvaluator, payloadSanitizer, outputRenderer, properties,
                Ticker.systemTicker());
    }

    FormSessionService(TemplateCatalogSource catalogSource, GenerationClient generationClient,
                       FormulaEvaluator formulaEvaluator, PayloadSanitizer payloadSanitizer,
                       OutputRenderer outputRenderer, FactFindProperties properties, Ticker ticker) {
        this.catalogSource = catalogSource;
        this.generationClient = generationClient;
        this.formulaEvaluator = formulaEvaluator;
        this.payloadSanitizer = payloadSanitizer;
        this.outputRenderer = outputRenderer;
        this.properties = properties;

        FactFindProperties.Session config = properties.getSession();
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(config.getIdleTimeout())
                .maximumSize(config.getMaxSessions())
                .ticker(ticker)
                .executor(Runnable::run)
                .<String, FormSession>removalListener(this::onRemoval)
                .build();
    }

    /**
     * Open a session and start loading its template listing.
     */
    public FormSession create() {
        String id = UUID.randomUUID().toString();
        FormSession session = new FormSession(id, catalogSource, generationClient, formulaEvaluator,
                payloadSanitizer, outputRenderer, properties.getSession().isAutoSelectFirst());
        sessions.put(id, session);
        log.info("Created form session {}", id);
        session.loadTemplates();
        return session;
    }

    public Optional<FormSession> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    /**
     * @throws SessionNotFoundException when the session does not exist, was disposed or expired
     */
    public FormSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean dispose(String sessionId) {
        if (sessionId == null) return false;
        return sessions.asMap().remove(sessionId) != null;
    }

    /**
     * Run pending expiry now instead of on the next cache access.
     */
    public void evictIdleSessions() {
        sessions.cleanUp();
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }

    private void onRemoval(String sessionId, FormSession session, RemovalCause cause) {
        if (session == null) return;
        session.dispose();
        if (cause == RemovalCause.EXPLICIT) {
            log.info("Disposed form session {}", sessionId);
        } else {
            log.info("Disposed form session {} ({})", sessionId, cause);
        }
    }
}
