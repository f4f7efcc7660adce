package com.flagship.smart_sync.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Per tenant+rail cool-down after the rail told us to stop.
 *
 * Throttling that outlasts our retries and authentication failures put the key
 * into a cool-down; while it lasts, calls fail fast with the original error
 * instead of hitting the rail again. Entries expire on their own.
 */
@Slf4j
public class CooldownRegistry {

    private final Cache<String, Cooldown> cooldowns;

    public CooldownRegistry(Ticker ticker) {
        this.cooldowns = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, Cooldown>() {
                    @Override
                    public long expireAfterCreate(String key, Cooldown value, long currentTime) {
                        return value.duration.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Cooldown value, long currentTime, long currentDuration) {
                        return value.duration.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Cooldown value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .build();
    }

    public void open(String key, ApiError error, Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        cooldowns.put(key, new Cooldown(error, duration));
        log.warn("Cool-down opened for {} ({}s) after {}", key, duration.toSeconds(), error.getType());
    }

    public Optional<ApiError> active(String key) {
        Cooldown cooldown = cooldowns.getIfPresent(key);
        return cooldown == null ? Optional.empty() : Optional.of(cooldown.error);
    }

    public void clear(String key) {
        cooldowns.invalidate(key);
    }

    private record Cooldown(ApiError error, Duration duration) {
    }
}
