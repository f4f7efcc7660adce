package com.flagship.smart_sync.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.mirror.MirrorSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Rebuilds an entity's state from its history.
 *
 * This is the correctness oracle for the mirror: folding an entity's entries in
 * order must give exactly the mirror row's content. It reads nothing but the
 * entries themselves.
 */
@Component
@RequiredArgsConstructor
public class LogReplayer {

    private final ObjectMapper objectMapper;

    /**
     * Folds entries (oldest first) into the final state.
     *
     * @return empty if there are no entries
     */
    public Optional<MirrorSnapshot> replay(List<TransactionLogEntry> history) {
        MirrorSnapshot state = null;
        for (TransactionLogEntry entry : history) {
            state = apply(state, entry);
        }
        return Optional.ofNullable(state);
    }

    private MirrorSnapshot apply(MirrorSnapshot current, TransactionLogEntry entry) {
        // every entry carries the complete state after the change
        MirrorSnapshot next = readSnapshot(entry);
        if (current != null && next.entity().getEntityType() != current.entity().getEntityType()) {
            throw new IllegalStateException("Entity type changed within history of " + entry.getEntityId());
        }
        return next;
    }

    private MirrorSnapshot readSnapshot(TransactionLogEntry entry) {
        try {
            return objectMapper.readValue(entry.getSnapshot(), MirrorSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable snapshot in log entry " + entry.getLogId(), e);
        }
    }
}
