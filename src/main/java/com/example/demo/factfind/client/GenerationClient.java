package com.example.demo.factfind.client;

import com.example.demo.factfind.model.GenerationRequest;
import com.example.demo.factfind.model.GenerationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to the document generation service.
 *
 * The returned future completes exceptionally with a
 * {@link com.example.demo.factfind.exception.GenerationTransportException} on network
 * failure or a non-2xx answer. Cancelling it aborts the request.
 */
public interface GenerationClient {

    CompletableFuture<GenerationResult> generate(GenerationRequest request);
}
