package com.flagship.smart_sync.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Backoff delays: exponential growth, cap, jitter range and the Retry-After floor.
 */
class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

    @Test
    @DisplayName("Nominal delay doubles per attempt and stops at the cap")
    void testNominalDelay_GrowsAndCaps() {
        assertEquals(Duration.ofSeconds(1), policy.nominalDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.nominalDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.nominalDelay(3));
        assertEquals(Duration.ofSeconds(16), policy.nominalDelay(5));
        assertEquals(Duration.ofSeconds(30), policy.nominalDelay(6));
        assertEquals(Duration.ofSeconds(30), policy.nominalDelay(500));
    }

    @Test
    @DisplayName("Attempt zero or below is treated as the first attempt")
    void testNominalDelay_NonPositiveAttempt() {
        assertEquals(Duration.ofSeconds(1), policy.nominalDelay(0));
        assertEquals(Duration.ofSeconds(1), policy.nominalDelay(-3));
    }

    @Test
    @DisplayName("Jittered delay stays between half the nominal delay and the nominal delay")
    void testDelayFor_JitterBounds() {
        assertEquals(Duration.ofMillis(2000), policy.delayFor(3, null, () -> 0.0));
        assertEquals(Duration.ofMillis(4000), policy.delayFor(3, null, () -> 1.0));
        assertEquals(Duration.ofMillis(3000), policy.delayFor(3, null, () -> 0.5));

        for (int i = 0; i < 100; i++) {
            Duration delay = policy.delayFor(4, null);
            assertTrue(delay.toMillis() >= 4000 && delay.toMillis() <= 8000, "delay out of range: " + delay);
        }
    }

    @Test
    @DisplayName("Retry-After is a floor, never a ceiling")
    void testDelayFor_RetryAfterFloor() {
        assertEquals(Duration.ofSeconds(10), policy.delayFor(1, 10L, () -> 1.0));
        // a smaller Retry-After does not shorten the backoff
        assertEquals(Duration.ofMillis(4000), policy.delayFor(3, 1L, () -> 1.0));
        assertEquals(Duration.ofMillis(500), policy.delayFor(1, 0L, () -> 0.0));
    }
}
