package com.flagship.smart_sync.config;

import com.flagship.smart_sync.client.BackoffPolicy;
import com.flagship.smart_sync.client.ClientSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds smart-sync.client.* properties to {@link ClientSettings}.
 *
 * Defaults follow QuickBooks Online's published limits: 30 calls per minute
 * per company, at least 500ms between calls, three attempts with 1s/2s/4s backoff.
 */
@Configuration
public class ClientConfig {

    @Bean
    public ClientSettings clientSettings(
            @Value("${smart-sync.client.calls-per-window:30}") int callsPerWindow,
            @Value("${smart-sync.client.window-seconds:60}") long windowSeconds,
            @Value("${smart-sync.client.min-interval-ms:500}") long minIntervalMs,
            @Value("${smart-sync.client.max-attempts:3}") int maxAttempts,
            @Value("${smart-sync.client.base-delay-ms:1000}") long baseDelayMs,
            @Value("${smart-sync.client.max-delay-ms:30000}") long maxDelayMs,
            @Value("${smart-sync.client.cache-ttl-seconds:30}") long cacheTtlSeconds,
            @Value("${smart-sync.client.rate-limit-cooldown-seconds:60}") long rateLimitCooldownSeconds,
            @Value("${smart-sync.client.auth-cooldown-seconds:300}") long authCooldownSeconds) {

        return ClientSettings.builder()
                .callsPerWindow(callsPerWindow)
                .window(Duration.ofSeconds(windowSeconds))
                .minInterval(Duration.ofMillis(minIntervalMs))
                .maxAttempts(maxAttempts)
                .backoff(new BackoffPolicy(Duration.ofMillis(baseDelayMs), 2.0, Duration.ofMillis(maxDelayMs)))
                .cacheTtl(Duration.ofSeconds(cacheTtlSeconds))
                .rateLimitCooldown(Duration.ofSeconds(rateLimitCooldownSeconds))
                .authCooldown(Duration.ofSeconds(authCooldownSeconds))
                // a caller never waits more than two windows for a permit
                .maxThrottleWait(Duration.ofSeconds(windowSeconds * 2))
                .build();
    }
}
