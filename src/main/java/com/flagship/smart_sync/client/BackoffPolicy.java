package com.flagship.smart_sync.client;

import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff.
 *
 * The nominal delay for attempt n is base * multiplier^(n-1), capped at max.
 * The actual delay is drawn uniformly from [nominal/2, nominal] so callers that
 * failed together do not retry together. A server-provided Retry-After is a floor.
 */
@Value
public class BackoffPolicy {
    Duration baseDelay;
    double multiplier;
    Duration maxDelay;

    public Duration delayFor(int attempt, Long retryAfterSeconds) {
        return delayFor(attempt, retryAfterSeconds, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Duration delayFor(int attempt, Long retryAfterSeconds, DoubleSupplier random) {
        Duration nominal = nominalDelay(attempt);
        long nominalMillis = nominal.toMillis();
        long half = nominalMillis / 2;
        long jittered = half + Math.round(random.getAsDouble() * (nominalMillis - half));

        Duration delay = Duration.ofMillis(jittered);
        if (retryAfterSeconds != null && retryAfterSeconds > 0) {
            Duration floor = Duration.ofSeconds(retryAfterSeconds);
            if (floor.compareTo(delay) > 0) {
                delay = floor;
            }
        }
        return delay;
    }

    public Duration nominalDelay(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double millis = baseDelay.toMillis() * Math.pow(multiplier, exponent);
        if (Double.isInfinite(millis) || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
