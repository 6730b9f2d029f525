package com.example.demo.factfind.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * RestClient shared by the template listing and generation clients, rooted at the
 * configured base URL.
 */
@Slf4j
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient generationRestClient(RestClient.Builder builder, FactFindProperties properties) {
        FactFindProperties.Generation generation = properties.getGeneration();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(generation.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(generation.getReadTimeout());

        log.info("Generation service base URL: {}", generation.normalizedBaseUrl());
        return builder
                .baseUrl(generation.normalizedBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
