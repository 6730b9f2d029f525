package com.example.demo.factfind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Application configuration for the fact-find engine.
 *
 * Example application.yml:
 *
 * factfind:
 *   generation:
 *     base-url: ${FACTFIND_GENERATION_BASE_URL:http://127.0.0.1:8000}
 *     ask-path: /ask
 *     templates-path: /form-templates
 *     connect-timeout: 5s
 *     read-timeout: 120s
 *   templates:
 *     remote-enabled: false
 *     location: templates/form-templates.yaml
 *   session:
 *     auto-select-first: true
 *     submit-wait-timeout: 130s
 *     idle-timeout: 30m
 *     max-sessions: 10000
 */
@Data
@Component
@ConfigurationProperties(prefix = "factfind")
public class FactFindProperties {

    private Generation generation = new Generation();

    private Templates templates = new Templates();

    private Session session = new Session();

    @Data
    public static class Generation {
        public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8000";

        /**
         * Base URL of the generation service; a trailing slash is ignored
         */
        private String baseUrl = DEFAULT_BASE_URL;

        private String askPath = "/ask";

        private String templatesPath = "/form-templates";

        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Generation can take a while; keep this generous
         */
        private Duration readTimeout = Duration.ofSeconds(120);

        public String normalizedBaseUrl() {
            String url = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            return url;
        }
    }

    @Data
    public static class Templates {
        /**
         * Fetch the listing from the generation service instead of the classpath
         */
        private boolean remoteEnabled = false;

        /**
         * Classpath listing used when remote loading is disabled (.yaml, .yml or .json)
         */
        private String location = "templates/form-templates.yaml";
    }

    @Data
    public static class Session {
        /**
         * Select the first template as soon as the listing is loaded
         */
        private boolean autoSelectFirst = true;

        /**
         * How long {@code POST /api/sessions/{id}/submit?wait=true} blocks for the outcome
         */
        private Duration submitWaitTimeout = Duration.ofSeconds(130);

        /**
         * Sessions not read or written for this long are disposed
         */
        private Duration idleTimeout = Duration.ofMinutes(30);

        /**
         * Upper bound on live sessions; the least recently used are disposed beyond it
         */
        private long maxSessions = 10_000;
    }
}
