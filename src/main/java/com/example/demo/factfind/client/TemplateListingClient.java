package com.example.demo.factfind.client;

import com.example.demo.factfind.config.FactFindProperties;
import com.example.demo.factfind.exception.TemplateLoadingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches the raw template listing ({@code GET {base}/form-templates}) from the
 * generation service.
 */
@Slf4j
@Component
public class TemplateListingClient {
    public static final String LISTING_UNAVAILABLE = "LISTING_UNAVAILABLE";

    private final RestClient restClient;
    private final String templatesPath;

    public TemplateListingClient(RestClient generationRestClient, FactFindProperties properties) {
        this.restClient = generationRestClient;
        this.templatesPath = properties.getGeneration().getTemplatesPath();
    }

    public String fetchListing() {
        try {
            String body = restClient.get()
                    .uri(templatesPath)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                throw new TemplateLoadingException(LISTING_UNAVAILABLE, "Template listing response was empty");
            }
            return body;
        } catch (RestClientException e) {
            log.warn("Failed to fetch template listing from {}: {}", templatesPath, e.getMessage());
            throw new TemplateLoadingException(LISTING_UNAVAILABLE, "Unable to load form templates", e);
        }
    }
}
