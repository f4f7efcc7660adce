package com.flagship.smart_sync.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * JDBC access to the per-entity-type mirror tables.
 *
 * All tables share one shape, so one set of statements serves every type; the
 * table name always comes from {@link EntityType}, never from input. Every
 * statement is scoped by tenant_id except the reconciler's cross-tenant scan.
 */
@Repository
@RequiredArgsConstructor
public class MirrorRepository {

    private static final String COLUMNS = """
            id, tenant_id, external_id, counterparty_name, amount, currency, due_date, status,
            attributes, source_version, record_status, sync_source, last_synced_at, log_pending,
            created_at, updated_at""";

    private static final TypeReference<TreeMap<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public Optional<MirrorRecord> findByExternalId(UUID tenantId, EntityType type, String externalId, boolean forUpdate) {
        String sql = "SELECT " + COLUMNS + " FROM " + type.tableName()
                + " WHERE tenant_id = ? AND external_id = ?" + (forUpdate ? " FOR UPDATE" : "");
        return jdbcTemplate.query(sql, rowMapper(type), tenantId, externalId).stream().findFirst();
    }

    public Optional<MirrorRecord> findById(UUID tenantId, EntityType type, UUID id, boolean forUpdate) {
        String sql = "SELECT " + COLUMNS + " FROM " + type.tableName()
                + " WHERE tenant_id = ? AND id = ?" + (forUpdate ? " FOR UPDATE" : "");
        return jdbcTemplate.query(sql, rowMapper(type), tenantId, id).stream().findFirst();
    }

    /**
     * Inserts a new row unless another row already holds its external id.
     *
     * @return false if the insert lost a race for (tenant_id, external_id)
     */
    public boolean insert(MirrorRecord record) {
        CanonicalEntity e = record.getEntity();
        int rows = jdbcTemplate.update(
                "INSERT INTO " + e.getEntityType().tableName() + " (" + COLUMNS + ") "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?) "
                        + "ON CONFLICT (tenant_id, external_id) DO NOTHING",
                record.getId(),
                record.getTenantId(),
                e.getExternalId(),
                e.getCounterpartyName(),
                e.getAmount(),
                e.getCurrency(),
                toSqlDate(e),
                e.getStatus(),
                writeAttributes(e.getAttributes()),
                e.getSourceVersion(),
                record.getRecordStatus().name(),
                record.getSyncSource(),
                toTimestamp(record.getLastSyncedAt()),
                record.isLogPending(),
                toTimestamp(record.getCreatedAt()),
                toTimestamp(record.getUpdatedAt())
        );
        return rows == 1;
    }

    /**
     * Overwrites content and bookkeeping of an existing row.
     */
    public void update(MirrorRecord record) {
        CanonicalEntity e = record.getEntity();
        int rows = jdbcTemplate.update(
                "UPDATE " + e.getEntityType().tableName() + " SET "
                        + "external_id = ?, counterparty_name = ?, amount = ?, currency = ?, due_date = ?, "
                        + "status = ?, attributes = ?::jsonb, source_version = ?, record_status = ?, "
                        + "sync_source = ?, last_synced_at = ?, log_pending = ?, updated_at = ? "
                        + "WHERE tenant_id = ? AND id = ?",
                e.getExternalId(),
                e.getCounterpartyName(),
                e.getAmount(),
                e.getCurrency(),
                toSqlDate(e),
                e.getStatus(),
                writeAttributes(e.getAttributes()),
                e.getSourceVersion(),
                record.getRecordStatus().name(),
                record.getSyncSource(),
                toTimestamp(record.getLastSyncedAt()),
                record.isLogPending(),
                toTimestamp(record.getUpdatedAt()),
                record.getTenantId(),
                record.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Mirror row " + record.getId() + " not found for update");
        }
    }

    /**
     * Records that a sync saw the row unchanged. Content and updated_at stay as they are.
     */
    public void touchSynced(UUID tenantId, EntityType type, UUID id, String source, Instant syncedAt) {
        jdbcTemplate.update(
                "UPDATE " + type.tableName() + " SET last_synced_at = ?, sync_source = ? WHERE tenant_id = ? AND id = ?",
                toTimestamp(syncedAt), source, tenantId, id);
    }

    /**
     * Clears log_pending if the row still holds the change that was logged.
     * A newer change keeps the flag for its own pairing.
     */
    public boolean clearLogPending(UUID tenantId, EntityType type, UUID id, Instant changedAt) {
        int rows = jdbcTemplate.update(
                "UPDATE " + type.tableName() + " SET log_pending = FALSE WHERE tenant_id = ? AND id = ? AND updated_at = ?",
                tenantId, id, toTimestamp(changedAt));
        return rows == 1;
    }

    /**
     * Rows whose latest change has no log entry yet, across tenants. Only rows
     * older than {@code changedBefore} are returned so writers still inside
     * their own pairing are left alone.
     */
    public List<MirrorRecord> findLogPending(EntityType type, Instant changedBefore, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + type.tableName()
                + " WHERE log_pending AND updated_at < ? ORDER BY updated_at ASC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper(type), toTimestamp(changedBefore), limit);
    }

    public long countLogPending(EntityType type) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + type.tableName() + " WHERE log_pending", Long.class);
        return count == null ? 0 : count;
    }

    public List<MirrorRecord> query(UUID tenantId, EntityType type, MirrorFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + type.tableName() + " WHERE tenant_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(tenantId);

        if (!filter.isIncludeDeleted()) {
            sql.append(" AND record_status = 'ACTIVE'");
        }
        if (filter.getStatuses() != null && !filter.getStatuses().isEmpty()) {
            sql.append(" AND status IN (");
            sql.append(String.join(", ", filter.getStatuses().stream().map(s -> "?").toList()));
            sql.append(")");
            params.addAll(filter.getStatuses());
        }
        if (filter.getCounterpartyName() != null) {
            sql.append(" AND counterparty_name = ?");
            params.add(filter.getCounterpartyName());
        }
        if (filter.getDueOnOrBefore() != null) {
            sql.append(" AND due_date <= ?");
            params.add(Date.valueOf(filter.getDueOnOrBefore()));
        }
        if (filter.getDueOnOrAfter() != null) {
            sql.append(" AND due_date >= ?");
            params.add(Date.valueOf(filter.getDueOnOrAfter()));
        }
        if (filter.getMinAmount() != null) {
            sql.append(" AND amount >= ?");
            params.add(filter.getMinAmount());
        }
        if (filter.getAttributeName() != null && filter.getAttributeValue() != null) {
            sql.append(" AND attributes ->> ? = ?");
            params.add(filter.getAttributeName());
            params.add(filter.getAttributeValue());
        }
        sql.append(" ORDER BY due_date ASC NULLS LAST, created_at ASC, id ASC LIMIT ? OFFSET ?");
        params.add(filter.getLimit());
        params.add(filter.getOffset());

        return jdbcTemplate.query(sql.toString(), rowMapper(type), params.toArray());
    }

    private RowMapper<MirrorRecord> rowMapper(EntityType type) {
        return (rs, rowNum) -> new MirrorRecord(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                CanonicalEntity.builder()
                        .entityType(type)
                        .externalId(rs.getString("external_id"))
                        .counterpartyName(rs.getString("counterparty_name"))
                        .amount(rs.getBigDecimal("amount"))
                        .currency(rs.getString("currency"))
                        .dueDate(readDate(rs))
                        .status(rs.getString("status"))
                        .sourceVersion(rs.getString("source_version"))
                        .attributes(readAttributes(rs.getString("attributes")))
                        .build(),
                RecordStatus.valueOf(rs.getString("record_status")),
                rs.getString("sync_source"),
                toInstant(rs.getTimestamp("last_synced_at")),
                rs.getBoolean("log_pending"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static LocalDate readDate(ResultSet rs) throws SQLException {
        Date date = rs.getDate("due_date");
        return date == null ? null : date.toLocalDate();
    }

    private static Date toSqlDate(CanonicalEntity e) {
        return e.getDueDate() == null ? null : Date.valueOf(e.getDueDate());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String writeAttributes(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize mirror attributes", e);
        }
    }

    private Map<String, String> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable mirror attributes: " + json, e);
        }
    }
}
