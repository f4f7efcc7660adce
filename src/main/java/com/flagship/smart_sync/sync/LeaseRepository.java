package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lease table access. Every statement is a single atomic row operation;
 * nothing here waits on another holder.
 */
@Repository
@RequiredArgsConstructor
public class LeaseRepository {

    private static final RowMapper<SyncLease> ROW_MAPPER = (rs, rowNum) -> new SyncLease(
            new SyncKey(rs.getObject("tenant_id", UUID.class), rs.getString("rail"),
                    EntityType.valueOf(rs.getString("entity_type"))),
            rs.getObject("holder", UUID.class),
            rs.getTimestamp("acquired_at").toInstant(),
            rs.getTimestamp("expires_at").toInstant());

    private final JdbcTemplate jdbcTemplate;

    /**
     * Takes the lease if it is free or its previous holder's lease has expired.
     *
     * @return true if {@code holder} now owns the lease
     */
    public boolean tryAcquire(SyncKey key, UUID holder, Instant now, Instant expiresAt) {
        int rows = jdbcTemplate.update("""
                INSERT INTO sync_leases (tenant_id, rail, entity_type, holder, acquired_at, expires_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (tenant_id, rail, entity_type) DO UPDATE
                SET holder = EXCLUDED.holder,
                    acquired_at = EXCLUDED.acquired_at,
                    expires_at = EXCLUDED.expires_at
                WHERE sync_leases.expires_at < EXCLUDED.acquired_at
                """,
                key.getTenantId(), key.getRail(), key.getEntityType().name(), holder,
                Timestamp.from(now), Timestamp.from(expiresAt));
        return rows == 1;
    }

    public boolean isHeldBy(SyncKey key, UUID holder) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM sync_leases
                WHERE tenant_id = ? AND rail = ? AND entity_type = ? AND holder = ?
                """, Integer.class,
                key.getTenantId(), key.getRail(), key.getEntityType().name(), holder);
        return count != null && count > 0;
    }

    /**
     * Deletes the lease only if {@code holder} still owns it.
     */
    public boolean release(SyncKey key, UUID holder) {
        return jdbcTemplate.update("""
                DELETE FROM sync_leases
                WHERE tenant_id = ? AND rail = ? AND entity_type = ? AND holder = ?
                """,
                key.getTenantId(), key.getRail(), key.getEntityType().name(), holder) == 1;
    }

    /**
     * Deletes the lease whoever holds it.
     */
    public boolean releaseAny(SyncKey key) {
        return jdbcTemplate.update("""
                DELETE FROM sync_leases
                WHERE tenant_id = ? AND rail = ? AND entity_type = ?
                """,
                key.getTenantId(), key.getRail(), key.getEntityType().name()) == 1;
    }

    public List<SyncLease> deleteForTenant(UUID tenantId) {
        return jdbcTemplate.query("""
                DELETE FROM sync_leases WHERE tenant_id = ?
                RETURNING tenant_id, rail, entity_type, holder, acquired_at, expires_at
                """, ROW_MAPPER, tenantId);
    }

    public List<SyncLease> findExpired(Instant now) {
        return jdbcTemplate.query("""
                SELECT tenant_id, rail, entity_type, holder, acquired_at, expires_at
                FROM sync_leases WHERE expires_at < ?
                ORDER BY expires_at
                """, ROW_MAPPER, Timestamp.from(now));
    }

    public List<SyncLease> findForTenant(UUID tenantId) {
        return jdbcTemplate.query("""
                SELECT tenant_id, rail, entity_type, holder, acquired_at, expires_at
                FROM sync_leases WHERE tenant_id = ?
                """, ROW_MAPPER, tenantId);
    }
}
