package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.rail.RailRecord;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Position in a rail's modification order: the last committed record's
 * modification time, with its external id as tie-breaker.
 *
 * Serialized as {@code <instant>|<externalId>}.
 */
@Value
public class CursorToken implements Comparable<CursorToken> {

    private static final Comparator<CursorToken> ORDER = Comparator
            .comparing(CursorToken::getLastUpdated)
            .thenComparing(CursorToken::getExternalId);

    Instant lastUpdated;
    String externalId;

    public static CursorToken of(RailRecord record) {
        return new CursorToken(record.getLastUpdated(), record.getExternalId());
    }

    /**
     * Position just ahead of every record modified at {@code lastUpdated}.
     */
    public static CursorToken before(Instant lastUpdated) {
        return new CursorToken(lastUpdated, "");
    }

    /**
     * Parses a stored token; null or blank means "from the beginning".
     */
    public static CursorToken parse(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        int separator = token.indexOf('|');
        if (separator <= 0) {
            throw new IllegalArgumentException("Malformed cursor token: " + token);
        }
        try {
            return new CursorToken(Instant.parse(token.substring(0, separator)), token.substring(separator + 1));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed cursor token: " + token, e);
        }
    }

    public static String format(CursorToken token) {
        return token == null ? null : token.toString();
    }

    /**
     * True when the record lies after this position and still needs processing.
     */
    public boolean precedes(RailRecord record) {
        return compareTo(of(record)) < 0;
    }

    @Override
    public int compareTo(CursorToken other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return lastUpdated + "|" + externalId;
    }
}
