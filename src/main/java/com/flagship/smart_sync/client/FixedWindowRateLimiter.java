package com.flagship.smart_sync.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed-window rate limiter keyed by tenant and rail.
 *
 * Each key gets at most {@code callsPerWindow} permits per window, and permits
 * are spaced at least {@code minInterval} apart. Window state lives in a Caffeine
 * cache and is updated with an atomic compute, so concurrent callers for the same
 * key never both get the last permit. Keys for different tenants never contend.
 *
 * The ticker is injectable so tests can move time without sleeping.
 */
@Slf4j
public class FixedWindowRateLimiter {

    private final Cache<String, Window> windows;
    private final Ticker ticker;
    private final int callsPerWindow;
    private final long windowNanos;
    private final long minIntervalNanos;

    public FixedWindowRateLimiter(int callsPerWindow, Duration window, Duration minInterval, Ticker ticker) {
        if (callsPerWindow <= 0) {
            throw new IllegalArgumentException("callsPerWindow must be positive");
        }
        this.callsPerWindow = callsPerWindow;
        this.windowNanos = window.toNanos();
        this.minIntervalNanos = minInterval.toNanos();
        this.ticker = ticker;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(window.multipliedBy(2))
                .ticker(ticker)
                .build();
    }

    /**
     * Takes a permit if one is available.
     *
     * @return zero when the permit was granted, otherwise how long to wait before asking again
     */
    public Duration tryAcquire(String key) {
        long now = ticker.read();
        long[] waitNanos = {0L};

        windows.asMap().compute(key, (k, current) -> {
            Window window = current;
            if (window == null || now - window.start >= windowNanos) {
                window = new Window(now, 0, window == null ? null : window.lastPermit);
            }

            if (window.count >= callsPerWindow) {
                waitNanos[0] = window.start + windowNanos - now;
                return window;
            }

            if (window.lastPermit != null && now - window.lastPermit < minIntervalNanos) {
                waitNanos[0] = window.lastPermit + minIntervalNanos - now;
                return window;
            }

            return new Window(window.start, window.count + 1, now);
        });

        return Duration.ofNanos(Math.max(0L, waitNanos[0]));
    }

    /**
     * Blocks until a permit is granted or {@code maxWait} would be exceeded.
     *
     * @return false if no permit could be obtained within {@code maxWait}
     */
    public boolean acquire(String key, Duration maxWait, Sleeper sleeper) throws InterruptedException {
        Duration waited = Duration.ZERO;
        while (true) {
            Duration wait = tryAcquire(key);
            if (wait.isZero()) {
                return true;
            }
            if (waited.plus(wait).compareTo(maxWait) > 0) {
                log.warn("Rate window for {} is full, next permit in {}ms exceeds max wait", key, wait.toMillis());
                return false;
            }
            sleeper.sleep(wait);
            waited = waited.plus(wait);
        }
    }

    /**
     * Permits used in the current window (for tests and diagnostics).
     */
    public int permitsUsed(String key) {
        Window window = windows.getIfPresent(key);
        if (window == null || ticker.read() - window.start >= windowNanos) {
            return 0;
        }
        return window.count;
    }

    private static final class Window {
        final long start;
        final int count;
        final Long lastPermit;

        Window(long start, int count, Long lastPermit) {
            this.start = start;
            this.count = count;
            this.lastPermit = lastPermit;
        }
    }
}
