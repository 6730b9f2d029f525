package com.example.demo.factfind.client;

import com.example.demo.factfind.config.AsyncConfig;
import com.example.demo.factfind.config.FactFindProperties;
import com.example.demo.factfind.exception.GenerationTransportException;
import com.example.demo.factfind.model.GenerationRequest;
import com.example.demo.factfind.model.GenerationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.concurrent.CompletableFuture;

/**
 * Sends submissions to {@code POST {base}/ask} with the shared {@link RestClient}.
 */
@Slf4j
@Component
public class RestGenerationClient implements GenerationClient {
    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String GENERATION_UNREACHABLE = "GENERATION_UNREACHABLE";
    public static final String EMPTY_RESPONSE = "EMPTY_RESPONSE";

    private final RestClient restClient;
    private final AsyncTaskExecutor executor;
    private final String askPath;

    public RestGenerationClient(RestClient generationRestClient,
                                @Qualifier(AsyncConfig.GENERATION_EXECUTOR) AsyncTaskExecutor executor,
                                FactFindProperties properties) {
        this.restClient = generationRestClient;
        this.executor = executor;
        this.askPath = properties.getGeneration().getAskPath();
    }

    @Override
    public CompletableFuture<GenerationResult> generate(GenerationRequest request) {
        return CancellableCalls.submit(executor, () -> post(request));
    }

    GenerationResult post(GenerationRequest request) {
        log.info("Requesting document generation for form type {}", request.getFormType());
        try {
            GenerationResult result = restClient.post()
                    .uri(askPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(GenerationResult.class);
            if (result == null) {
                throw new GenerationTransportException(EMPTY_RESPONSE,
                        "Generation service returned an empty body", null, null);
            }
            return result;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Generation request failed with status {}: {}", status, e.getResponseBodyAsString());
            throw new GenerationTransportException(GENERATION_FAILED,
                    "Request failed with status " + status, status, e);
        } catch (ResourceAccessException e) {
            log.warn("Generation service unreachable: {}", e.getMessage());
            throw new GenerationTransportException(GENERATION_UNREACHABLE,
                    "Generation service unreachable", null, e);
        } catch (RestClientException e) {
            log.warn("Generation response could not be read: {}", e.getMessage());
            throw new GenerationTransportException(GENERATION_FAILED,
                    "Generation response could not be read", null, e);
        }
    }
}
