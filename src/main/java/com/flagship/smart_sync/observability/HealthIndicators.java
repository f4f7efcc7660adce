package com.flagship.smart_sync.observability;

import com.flagship.smart_sync.mirror.MirrorPersistenceService;
import com.flagship.smart_sync.sync.SyncCursorService;
import com.flagship.smart_sync.sync.SyncState;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the sync layer.
 *
 * None of these take the service out of rotation on their own: the mirror keeps
 * serving reads while syncs are failing, so sync problems report WARNING and only
 * a database failure reports DOWN.
 */
public class HealthIndicators {

    /**
     * Audit gaps waiting for the log reconciler.
     */
    @Component("logPendingHealth")
    public static class LogPendingHealthIndicator implements HealthIndicator {

        private static final long WARNING_THRESHOLD = 1;
        private static final long CRITICAL_THRESHOLD = 1000;

        private final MirrorPersistenceService mirrorPersistence;

        public LogPendingHealthIndicator(MirrorPersistenceService mirrorPersistence) {
            this.mirrorPersistence = mirrorPersistence;
        }

        @Override
        public Health health() {
            try {
                long pending = mirrorPersistence.countLogPending();

                Health.Builder builder = pending < WARNING_THRESHOLD
                        ? Health.up()
                        : pending < CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("logPendingRows", pending)
                        .withDetail("criticalThreshold", CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Sync keys that stopped and need a tenant or operator.
     */
    @Component("syncAttentionHealth")
    public static class SyncAttentionHealthIndicator implements HealthIndicator {

        private final SyncCursorService cursorService;

        public SyncAttentionHealthIndicator(SyncCursorService cursorService) {
            this.cursorService = cursorService;
        }

        @Override
        public Health health() {
            try {
                long fatal = cursorService.countByState(SyncState.FAILED_FATAL);
                long retrying = cursorService.countByState(SyncState.FAILED_RETRYABLE);
                long running = cursorService.countByState(SyncState.RUNNING);

                Health.Builder builder = fatal == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("failedFatal", fatal)
                        .withDetail("failedRetryable", retrying)
                        .withDetail("running", running)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis backs the log idempotency fast path only; the database remains the
     * source of truth, so a Redis outage is DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.up()
                        .withDetail("note", "Redis not configured, log idempotency uses the database")
                        .build();
            }

            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Log idempotency falls back to the database")
                        .build();
            }
        }
    }
}
