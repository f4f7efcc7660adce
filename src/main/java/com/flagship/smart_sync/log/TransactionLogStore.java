package com.flagship.smart_sync.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.exception.DuplicateLogEntryException;
import com.flagship.smart_sync.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of change records.
 *
 * Guarantees:
 * - Entries are written once and never changed or removed
 * - Appending the same logical change twice is rejected, not duplicated:
 *   the idempotency key is checked up front and enforced by a unique index
 * - {@link #history} returns an entity's entries oldest first, each with a
 *   full snapshot, so the sequence alone reconstructs current state
 *
 * Duplicate detection uses a Redis fast path when Redis is configured; the
 * database index is the source of truth, so Redis being down only costs a query.
 *
 * Appends run in their own transaction: a failed append never rolls back the
 * mirror write it documents.
 */
@Service
@Slf4j
public class TransactionLogStore {

    private static final String REDIS_KEY_PREFIX = "log-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final String IDEMPOTENCY_CONSTRAINT = "uq_transaction_log_idempotency";

    private final TransactionLogRepository repository;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final Optional<StringRedisTemplate> redisTemplate;

    public TransactionLogStore(TransactionLogRepository repository,
                               ObjectMapper objectMapper,
                               SyncMetrics metrics,
                               Optional<StringRedisTemplate> redisTemplate) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Appends one entry.
     *
     * @return the new entry's log id
     * @throws DuplicateLogEntryException if an entry with the same idempotency key exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID append(NewLogEntry entry) {
        validate(entry);
        String key = entry.resolveIdempotencyKey();

        if (seenInRedis(key) || repository.existsByIdempotencyKey(key)) {
            metrics.recordLogAppend(entry.getSource(), "duplicate");
            log.debug("Rejected duplicate log append: entityId={}, key={}", entry.getEntityId(), key);
            throw new DuplicateLogEntryException(key);
        }

        TransactionLogEntry record = new TransactionLogEntry(
                UUID.randomUUID(),
                null,
                entry.getTenantId(),
                entry.getEntityType(),
                entry.getEntityId(),
                entry.getOperationKind(),
                entry.getSource(),
                toJson(entry.getSnapshot()),
                toJson(entry.getDiff() == null ? Map.of() : entry.getDiff()),
                entry.getActorId(),
                entry.getOccurredAt(),
                key
        );

        try {
            repository.saveAndFlush(TransactionLogEntryEntity.fromDomain(record));
        } catch (DataIntegrityViolationException e) {
            if (isIdempotencyViolation(e)) {
                metrics.recordLogAppend(entry.getSource(), "duplicate");
                throw new DuplicateLogEntryException(key);
            }
            throw e;
        }

        remember(key, record.getLogId());
        metrics.recordLogAppend(entry.getSource(), "appended");
        log.debug("Appended log entry: logId={}, entityType={}, entityId={}, kind={}, source={}",
                record.getLogId(), entry.getEntityType(), entry.getEntityId(),
                entry.getOperationKind(), entry.getSource());

        return record.getLogId();
    }

    /**
     * All entries for an entity, oldest to newest.
     */
    @Transactional(readOnly = true)
    public List<TransactionLogEntry> history(UUID tenantId, UUID entityId) {
        return repository.findHistory(tenantId, entityId)
                .stream()
                .map(TransactionLogEntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countForEntity(UUID tenantId, UUID entityId) {
        return repository.countByTenantIdAndEntityId(tenantId, entityId);
    }

    private void validate(NewLogEntry entry) {
        if (entry.getTenantId() == null) {
            throw new IllegalArgumentException("Log entry tenantId is required");
        }
        if (entry.getEntityId() == null || entry.getEntityType() == null) {
            throw new IllegalArgumentException("Log entry entity reference is required");
        }
        if (entry.getOperationKind() == null || entry.getOccurredAt() == null) {
            throw new IllegalArgumentException("Log entry operation kind and occurredAt are required");
        }
        if (entry.getSource() == null || entry.getSource().isBlank()) {
            throw new IllegalArgumentException("Log entry source is required");
        }
        if (entry.getSnapshot() == null) {
            throw new IllegalArgumentException("Log entry snapshot is required");
        }
    }

    private boolean seenInRedis(String key) {
        if (redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + key));
        } catch (Exception e) {
            log.warn("Redis lookup failed for log idempotency key, falling back to database: {}", e.getMessage());
            return false;
        }
    }

    private void remember(String key, UUID logId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + key, logId.toString(), REDIS_TTL);
        } catch (Exception e) {
            // database is the source of truth
            log.debug("Failed to cache log idempotency key in Redis: {}", e.getMessage());
        }
    }

    private boolean isIdempotencyViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(IDEMPOTENCY_CONSTRAINT);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize log entry content", e);
        }
    }
}
