package com.flagship.smart_sync.client;

import java.time.Duration;

/**
 * Pause used between retries and while waiting for a rate window.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
