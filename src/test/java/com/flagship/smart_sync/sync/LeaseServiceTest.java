package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lease table tests.
 *
 * These tests verify that:
 * - Only one holder gets a key's lease, also under concurrent attempts
 * - A holder can only release its own lease; cancel releases any holder's
 * - Expired leases can be taken over and are found by the watchdog
 * - The watchdog path fails a stuck run as a timeout and frees the key
 */
@SpringBootTest
@Testcontainers
class LeaseServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("smart_sync_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private LeaseService leaseService;

    @Autowired
    private LeaseRepository leaseRepository;

    @Autowired
    private SyncCursorService cursorService;

    @Autowired
    private SyncOrchestrator orchestrator;

    @Autowired
    private SyncStatusService statusService;

    private SyncKey key;

    @BeforeEach
    void setUp() {
        key = new SyncKey(UUID.randomUUID(), FakeLedgerRail.RAIL_ID, EntityType.BILL);
    }

    private SyncLease expiredLease(SyncKey target) {
        Instant acquired = Instant.now().minus(20, ChronoUnit.MINUTES);
        Instant expired = Instant.now().minus(10, ChronoUnit.MINUTES);
        UUID holder = UUID.randomUUID();
        assertTrue(leaseRepository.tryAcquire(target, holder, acquired, expired));
        return new SyncLease(target, holder, acquired, expired);
    }

    @Test
    @DisplayName("A held lease is not handed out again until its holder releases it")
    void testTryAcquire_IsExclusive() {
        SyncLease lease = leaseService.tryAcquire(key).orElseThrow();

        assertTrue(leaseService.isHeld(lease));
        assertTrue(leaseService.tryAcquire(key).isEmpty());
        assertTrue(leaseService.tryAcquire(new SyncKey(key.getTenantId(), key.getRail(), EntityType.VENDOR)).isPresent());
        assertTrue(leaseService.tryAcquire(new SyncKey(UUID.randomUUID(), key.getRail(), EntityType.BILL)).isPresent());

        leaseService.release(lease);
        assertFalse(leaseService.isHeld(lease));
        assertTrue(leaseService.tryAcquire(key).isPresent());
    }

    @Test
    @DisplayName("Concurrent acquisitions of one key: exactly one wins")
    void testTryAcquire_ConcurrentAttempts() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<SyncLease>>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<Optional<SyncLease>> attempt = () -> {
                    start.await();
                    return leaseService.tryAcquire(key);
                };
                attempts.add(executor.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<SyncLease>> attempt : attempts) {
                if (attempt.get().isPresent()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Releasing with a stale holder id leaves the current lease alone")
    void testRelease_OnlyOwnLease() {
        SyncLease lease = leaseService.tryAcquire(key).orElseThrow();
        SyncLease impostor = new SyncLease(key, UUID.randomUUID(), lease.getAcquiredAt(), lease.getExpiresAt());

        leaseService.release(impostor);
        assertTrue(leaseService.isHeld(lease));

        assertTrue(leaseService.cancel(key));
        assertFalse(leaseService.isHeld(lease));
        assertFalse(leaseService.cancel(key));
    }

    @Test
    @DisplayName("An expired lease is visible to the watchdog and can be taken over")
    void testExpiredLease_TakeOver() {
        SyncLease stale = expiredLease(key);

        assertTrue(leaseService.findExpired().stream().anyMatch(l -> l.getKey().equals(key)));

        SyncLease fresh = leaseService.tryAcquire(key).orElseThrow();
        assertFalse(leaseService.isHeld(stale));
        assertTrue(leaseService.isHeld(fresh));
        // the watchdog must not remove a lease that was taken over
        assertFalse(leaseService.forceRelease(stale));
        assertTrue(leaseService.isHeld(fresh));
    }

    @Test
    @DisplayName("Watchdog on a stuck run: lease freed, cursor FAILED_RETRYABLE with TIMEOUT, run recorded")
    void testHandleExpiredLease_FailsStuckRun() {
        SyncCursor running = cursorService.save(cursorService.getOrCreate(key).start(Instant.now().minusSeconds(1200)));
        assertEquals(SyncState.RUNNING, running.getState());
        SyncLease stale = expiredLease(key);

        orchestrator.handleExpiredLease(stale);

        assertTrue(leaseService.findForTenant(key.getTenantId()).isEmpty());
        SyncCursor failed = cursorService.find(key).orElseThrow();
        assertEquals(SyncState.FAILED_RETRYABLE, failed.getState());
        assertEquals(SyncErrorKind.TIMEOUT, failed.getLastErrorKind());
        assertEquals(1, failed.getConsecutiveFailures());

        List<SyncRun> runs = statusService.recentRuns(key.getTenantId(), key.getRail(), key.getEntityType());
        assertEquals(1, runs.size());
        assertEquals(SyncOutcome.TIMED_OUT, runs.get(0).getOutcome());

        // a second pass over the same lease does nothing
        orchestrator.handleExpiredLease(stale);
        assertEquals(1, statusService.recentRuns(key.getTenantId(), key.getRail(), key.getEntityType()).size());
    }
}
