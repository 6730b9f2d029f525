package com.example.demo.factfind.service;

import com.example.demo.factfind.client.CancellableCalls;
import com.example.demo.factfind.config.AsyncConfig;
import com.example.demo.factfind.exception.TemplateLoadingException;
import com.example.demo.factfind.exception.TemplateNotFoundException;
import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.model.TemplateCatalog;
import com.example.demo.factfind.model.TemplateSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Holds the templates loaded for this process. The listing is loaded once, at startup;
 * when that fails it is retried on the next request that needs it.
 */
@Slf4j
@Component
public class TemplateRegistry implements TemplateCatalogSource {

    private final TemplateLoader templateLoader;
    private final AsyncTaskExecutor executor;

    private volatile TemplateCatalog catalog;

    public TemplateRegistry(TemplateLoader templateLoader,
                            @Qualifier(AsyncConfig.GENERATION_EXECUTOR) AsyncTaskExecutor executor) {
        this.templateLoader = templateLoader;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        try {
            ensureLoaded();
        } catch (TemplateLoadingException e) {
            log.warn("Form templates could not be loaded at startup: {} - {}", e.getCode(), e.getDescription());
        }
    }

    /**
     * The loaded catalog, loading it first when needed
     *
     * @throws TemplateLoadingException when the listing cannot be loaded
     */
    public TemplateCatalog ensureLoaded() {
        TemplateCatalog current = catalog;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (catalog == null) {
                catalog = templateLoader.loadCatalog();
            }
            return catalog;
        }
    }

    @Override
    public CompletableFuture<TemplateCatalog> fetchCatalog() {
        TemplateCatalog current = catalog;
        if (current != null) {
            return CompletableFuture.completedFuture(current);
        }
        return CancellableCalls.submit(executor, this::ensureLoaded);
    }

    /**
     * @throws TemplateNotFoundException when no loaded template has that id
     */
    public FormTemplate getTemplate(String templateId) {
        return ensureLoaded().find(templateId).orElseThrow(() -> new TemplateNotFoundException(templateId));
    }

    public List<TemplateSummary> listTemplates() {
        return ensureLoaded().getTemplates().stream().map(TemplateSummary::of).collect(Collectors.toList());
    }

    public TemplateCatalog currentCatalog() {
        return ensureLoaded();
    }
}
