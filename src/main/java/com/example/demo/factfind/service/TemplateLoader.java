package com.example.demo.factfind.service;

import com.example.demo.factfind.aspect.LogExecutionTime;
import com.example.demo.factfind.client.TemplateListingClient;
import com.example.demo.factfind.config.FactFindProperties;
import com.example.demo.factfind.exception.SchemaValidationException;
import com.example.demo.factfind.exception.TemplateLoadingException;
import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.model.RejectedTemplate;
import com.example.demo.factfind.model.TemplateCatalog;
import com.example.demo.factfind.model.TemplateListing;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the form template listing from JSON or YAML.
 * The listing comes from the generation service when remote loading is enabled, from the
 * classpath otherwise. Every template is validated on its own: a broken template is
 * reported and left out, the rest of the listing still loads.
 */
@Slf4j
@Component
public class TemplateLoader {
    public static final String LISTING_NOT_FOUND = "LISTING_NOT_FOUND";
    public static final String LISTING_PARSE_ERROR = "LISTING_PARSE_ERROR";
    public static final String UNSUPPORTED_LISTING_FORMAT = "UNSUPPORTED_LISTING_FORMAT";
    public static final String DUPLICATE_TEMPLATE_ID = "DUPLICATE_TEMPLATE_ID";

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TemplateListingClient listingClient;
    private final TemplateValidator validator;
    private final FactFindProperties properties;

    public TemplateLoader(TemplateListingClient listingClient, TemplateValidator validator, FactFindProperties properties) {
        this.listingClient = listingClient;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * Load and validate the whole listing
     *
     * @return the valid templates plus a report of the rejected ones
     */
    @LogExecutionTime("Loading Form Template Listing")
    public TemplateCatalog loadCatalog() {
        TemplateListing listing;
        if (properties.getTemplates().isRemoteEnabled()) {
            log.info("Loading form templates from generation service");
            listing = parseListing(listingClient.fetchListing(), jsonMapper, "remote listing");
        } else {
            listing = loadFromClasspath(properties.getTemplates().getLocation());
        }
        return buildCatalog(listing);
    }

    TemplateCatalog buildCatalog(TemplateListing listing) {
        List<FormTemplate> accepted = new ArrayList<>();
        List<RejectedTemplate> rejected = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (FormTemplate template : listing.getForms() == null ? List.<FormTemplate>of() : listing.getForms()) {
            if (template == null) continue;
            try {
                validator.validate(template);
                if (!ids.add(template.getId())) {
                    throw new SchemaValidationException(template.getId(), DUPLICATE_TEMPLATE_ID,
                            "Template id '" + template.getId() + "' is used more than once");
                }
                accepted.add(template);
            } catch (SchemaValidationException e) {
                log.warn("Rejected form template {}: {} - {}", e.getTemplateId(), e.getCode(), e.getDescription());
                rejected.add(new RejectedTemplate(e.getTemplateId(), e.getCode(), e.getDescription()));
            }
        }
        log.info("Loaded {} form templates ({} rejected)", accepted.size(), rejected.size());
        return new TemplateCatalog(accepted, rejected);
    }

    private TemplateListing loadFromClasspath(String location) {
        ObjectMapper mapper;
        if (location.endsWith(".json")) {
            mapper = jsonMapper;
        } else if (location.endsWith(".yaml") || location.endsWith(".yml")) {
            mapper = yamlMapper;
        } else {
            throw new TemplateLoadingException(UNSUPPORTED_LISTING_FORMAT,
                    "Template listing '" + location + "' does not have a supported extension. "
                            + "Use .json, .yaml, or .yml for listing files.");
        }
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new TemplateLoadingException(LISTING_NOT_FOUND,
                    "Template listing not found on classpath: " + location);
        }
        log.info("Loading form templates from classpath: {}", location);
        try (InputStream is = resource.getInputStream()) {
            return mapper.readValue(is, TemplateListing.class);
        } catch (IOException e) {
            throw new TemplateLoadingException(LISTING_PARSE_ERROR,
                    "Failed to parse template listing " + location + ": " + e.getMessage(), e);
        }
    }

    private TemplateListing parseListing(String content, ObjectMapper mapper, String source) {
        try {
            return mapper.readValue(content, TemplateListing.class);
        } catch (IOException e) {
            throw new TemplateLoadingException(LISTING_PARSE_ERROR,
                    "Failed to parse " + source + ": " + e.getMessage(), e);
        }
    }
}
