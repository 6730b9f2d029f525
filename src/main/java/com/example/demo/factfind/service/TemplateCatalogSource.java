package com.example.demo.factfind.service;

import com.example.demo.factfind.model.TemplateCatalog;

import java.util.concurrent.CompletableFuture;

/**
 * Where a form session gets its templates from. The future fails with a
 * {@link com.example.demo.factfind.exception.TemplateLoadingException} when the listing
 * cannot be loaded; cancelling it abandons the fetch.
 */
public interface TemplateCatalogSource {

    CompletableFuture<TemplateCatalog> fetchCatalog();
}
