package com.flagship.smart_sync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans for the sync layer.
 *
 * - The clock, injected everywhere time matters so tests can pin it
 * - A bounded executor for scheduled and webhook-driven sync runs
 * - The RestClient used for all rail traffic, with connect/read timeouts so
 *   every external call is bounded
 */
@Configuration
public class SyncInfrastructureConfig {

    /**
     * UTC clock truncated to microseconds, the precision Postgres stores, so an
     * instant written and read back compares equal.
     */
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofNanos(1_000));
    }

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(
            @Value("${smart-sync.executor.core-pool-size:4}") int corePoolSize,
            @Value("${smart-sync.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${smart-sync.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public RestClient railRestClient(
            @Value("${smart-sync.client.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${smart-sync.client.read-timeout-ms:30000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
