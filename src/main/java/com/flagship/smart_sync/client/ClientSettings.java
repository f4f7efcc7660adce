package com.flagship.smart_sync.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Limits and retry parameters for {@link RateLimitedClient}.
 */
@Value
@Builder
public class ClientSettings {
    int callsPerWindow;
    Duration window;
    Duration minInterval;
    int maxAttempts;
    BackoffPolicy backoff;
    Duration cacheTtl;
    Duration rateLimitCooldown;
    Duration authCooldown;
    Duration maxThrottleWait;   // longest a caller waits for a rate window before failing transiently
}
