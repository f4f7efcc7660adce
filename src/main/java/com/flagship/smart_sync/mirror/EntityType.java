package com.flagship.smart_sync.mirror;

import java.time.Duration;
import java.util.Locale;

/**
 * Ledger entity types that are mirrored locally.
 *
 * Each type has its own mirror table and a freshness window: data younger than
 * the soft TTL is served as-is, data older than the hard TTL is considered expired.
 */
public enum EntityType {
    BILL("mirror_bills", Duration.ofMinutes(5), Duration.ofHours(1)),
    INVOICE("mirror_invoices", Duration.ofMinutes(15), Duration.ofHours(1)),
    VENDOR("mirror_vendors", Duration.ofHours(1), Duration.ofHours(24)),
    CUSTOMER("mirror_customers", Duration.ofHours(1), Duration.ofHours(24)),
    PAYMENT("mirror_payments", Duration.ofMinutes(5), Duration.ofHours(1)),
    BALANCE("mirror_balances", Duration.ofMinutes(2), Duration.ofMinutes(10));

    private final String tableName;
    private final Duration softTtl;
    private final Duration hardTtl;

    EntityType(String tableName, Duration softTtl, Duration hardTtl) {
        this.tableName = tableName;
        this.softTtl = softTtl;
        this.hardTtl = hardTtl;
    }

    public String tableName() {
        return tableName;
    }

    public Duration softTtl() {
        return softTtl;
    }

    public Duration hardTtl() {
        return hardTtl;
    }

    /**
     * Parses a path segment such as "bill", "bills" or "BILL".
     */
    public static EntityType fromPath(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(normalized) || (type.name() + "S").equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
