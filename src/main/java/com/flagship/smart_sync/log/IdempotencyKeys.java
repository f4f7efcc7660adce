package com.flagship.smart_sync.log;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Derives log idempotency keys.
 *
 * The key is SHA-256 over entity id, source, occurrence time and operation kind,
 * so retrying the same logical change yields the same key while two distinct
 * changes to the same entity never collide.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String forChange(UUID entityId, String source, Instant occurredAt, OperationKind kind) {
        String material = entityId + "|" + source + "|" + occurredAt + "|" + kind.name();
        return sha256Hex(material);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
