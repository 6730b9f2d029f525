package com.example.demo.factfind.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for outbound calls to the generation service, so that sessions can
 * submit without blocking the request thread and abort a call in flight.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String GENERATION_EXECUTOR = "generationExecutor";

    @Bean(name = GENERATION_EXECUTOR)
    public ThreadPoolTaskExecutor generationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("generation-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Generation executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());
        return executor;
    }
}
