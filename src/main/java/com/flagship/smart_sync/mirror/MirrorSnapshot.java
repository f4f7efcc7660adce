package com.flagship.smart_sync.mirror;

/**
 * Full state of a mirror row as carried in a log entry.
 * Replaying the latest snapshot of an entity yields its mirror state.
 */
public record MirrorSnapshot(CanonicalEntity entity, RecordStatus recordStatus) {
}
