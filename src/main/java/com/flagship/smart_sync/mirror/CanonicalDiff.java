package com.flagship.smart_sync.mirror;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Field-level difference between two snapshots of the same entity.
 *
 * Only content is compared; bookkeeping such as last_synced_at never produces a change.
 * Amounts compare by value, so 500 and 500.0000 are equal.
 */
public final class CanonicalDiff {

    private CanonicalDiff() {
    }

    /**
     * @param before previous state, or null for a newly created entity
     * @param after  new state
     * @return changed fields keyed by name, sorted; empty when nothing changed
     */
    public static Map<String, FieldChange> between(MirrorSnapshot before, MirrorSnapshot after) {
        Map<String, FieldChange> changes = new TreeMap<>();
        CanonicalEntity a = before == null ? null : before.entity();
        CanonicalEntity b = after.entity();

        compare(changes, "externalId", a == null ? null : a.getExternalId(), b.getExternalId());
        compare(changes, "counterpartyName", a == null ? null : a.getCounterpartyName(), b.getCounterpartyName());
        compareAmount(changes, a == null ? null : a.getAmount(), b.getAmount());
        compare(changes, "currency", a == null ? null : a.getCurrency(), b.getCurrency());
        compare(changes, "dueDate", a == null ? null : a.getDueDate(), b.getDueDate());
        compare(changes, "status", a == null ? null : a.getStatus(), b.getStatus());
        compare(changes, "sourceVersion", a == null ? null : a.getSourceVersion(), b.getSourceVersion());
        compare(changes, "recordStatus", before == null ? null : before.recordStatus(), after.recordStatus());

        Map<String, String> beforeAttributes = a == null ? Map.of() : a.getAttributes();
        Map<String, String> afterAttributes = b.getAttributes();
        TreeSet<String> names = new TreeSet<>(beforeAttributes.keySet());
        names.addAll(afterAttributes.keySet());
        for (String name : names) {
            compare(changes, "attributes." + name, beforeAttributes.get(name), afterAttributes.get(name));
        }

        return changes;
    }

    private static void compare(Map<String, FieldChange> changes, String field, Object from, Object to) {
        if (!Objects.equals(from, to)) {
            changes.put(field, new FieldChange(asString(from), asString(to)));
        }
    }

    private static void compareAmount(Map<String, FieldChange> changes, BigDecimal from, BigDecimal to) {
        boolean equal = from == null ? to == null : to != null && from.compareTo(to) == 0;
        if (!equal) {
            changes.put("amount", new FieldChange(
                    from == null ? null : from.toPlainString(),
                    to == null ? null : to.toPlainString()));
        }
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
