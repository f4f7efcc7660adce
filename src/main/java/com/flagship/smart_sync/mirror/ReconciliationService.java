package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.log.LogReplayer;
import com.flagship.smart_sync.log.TransactionLogEntry;
import com.flagship.smart_sync.log.TransactionLogStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks a mirror row against the state its history replays to.
 *
 * The mirror is a materialized view over the log; this is where that claim is
 * verified. Rows still awaiting reconciliation are reported as pending rather
 * than as drift.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final MirrorStore mirrorStore;
    private final TransactionLogStore logStore;
    private final LogReplayer replayer;

    public ReconciliationReport verify(UUID tenantId, EntityType type, UUID entityId) {
        MirrorRecord record = mirrorStore.getById(tenantId, type, entityId)
                .orElseThrow(() -> new NotFoundException(type + " " + entityId + " not found"));

        List<TransactionLogEntry> history = logStore.history(tenantId, entityId);
        Optional<MirrorSnapshot> replayed = replayer.replay(history);
        MirrorSnapshot current = record.toSnapshot();

        boolean consistent = replayed.isPresent()
                && CanonicalDiff.between(replayed.get(), current).isEmpty();

        if (!consistent && !record.isLogPending()) {
            log.warn("Mirror drift detected: tenant={}, type={}, entityId={}, entries={}",
                    tenantId, type, entityId, history.size());
        }

        return new ReconciliationReport(entityId, type, history.size(), consistent,
                record.isLogPending(), current, replayed.orElse(null));
    }

    @Value
    public static class ReconciliationReport {
        UUID entityId;
        EntityType entityType;
        int historySize;
        boolean consistent;
        boolean logPending;
        MirrorSnapshot mirrorState;
        MirrorSnapshot replayedState;
    }
}
