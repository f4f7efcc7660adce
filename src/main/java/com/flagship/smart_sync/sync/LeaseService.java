package com.flagship.smart_sync.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * At-most-one-run-per-key via the sync_leases table.
 *
 * Key design decisions:
 * - Acquisition is try-only: a held lease means skip, never wait
 * - Leases carry a random holder id so a run can only release its own lease
 * - A lease expires after the maximum task duration; the watchdog clears expired
 *   leases and a new run may take one over
 * - Cancelling deletes the lease; the run notices before its next record
 */
@Service
@Slf4j
public class LeaseService {

    private final LeaseRepository repository;
    private final Clock clock;
    private final Duration leaseDuration;

    public LeaseService(LeaseRepository repository, Clock clock,
                        @Value("${smart-sync.sync.lease-duration-seconds:600}") long leaseDurationSeconds) {
        this.repository = repository;
        this.clock = clock;
        this.leaseDuration = Duration.ofSeconds(leaseDurationSeconds);
    }

    public Optional<SyncLease> tryAcquire(SyncKey key) {
        UUID holder = UUID.randomUUID();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(leaseDuration);
        if (repository.tryAcquire(key, holder, now, expiresAt)) {
            log.debug("Lease acquired for {} by {} until {}", key, holder, expiresAt);
            return Optional.of(new SyncLease(key, holder, now, expiresAt));
        }
        return Optional.empty();
    }

    /**
     * True while the lease has not been cancelled, force-released or taken over.
     */
    public boolean isHeld(SyncLease lease) {
        return repository.isHeldBy(lease.getKey(), lease.getHolder());
    }

    public void release(SyncLease lease) {
        if (!repository.release(lease.getKey(), lease.getHolder())) {
            log.debug("Lease for {} was already gone when holder {} released it", lease.getKey(), lease.getHolder());
        }
    }

    public boolean cancel(SyncKey key) {
        return repository.releaseAny(key);
    }

    public List<SyncLease> cancelTenant(UUID tenantId) {
        return repository.deleteForTenant(tenantId);
    }

    public List<SyncLease> findExpired() {
        return repository.findExpired(clock.instant());
    }

    /**
     * Removes an expired lease, unless it was renewed or taken over in the meantime.
     */
    public boolean forceRelease(SyncLease lease) {
        return repository.release(lease.getKey(), lease.getHolder());
    }

    public List<SyncLease> findForTenant(UUID tenantId) {
        return repository.findForTenant(tenantId);
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }
}
