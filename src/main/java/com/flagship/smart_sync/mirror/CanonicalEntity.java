package com.flagship.smart_sync.mirror;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;

/**
 * Rail-independent shape of a ledger entity.
 *
 * Every rail maps its native payload to this; mirror rows, log snapshots and
 * downstream views all speak it. Fields a type does not use stay null
 * (a vendor has no due date). Type-specific extras go into {@code attributes}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CanonicalEntity {

    public static final int AMOUNT_SCALE = 4;

    EntityType entityType;
    String externalId;          // null until the record exists on a rail
    String counterpartyName;    // vendor on bills, customer on invoices, display name on parties/accounts
    BigDecimal amount;          // open amount for bills/invoices, current balance for accounts
    String currency;
    LocalDate dueDate;
    String status;              // OPEN, PAID, SCHEDULED, ACTIVE ... as mapped by the rail
    String sourceVersion;       // rail's own version marker (e.g. QuickBooks SyncToken)
    @Singular
    Map<String, String> attributes;

    /**
     * Same entity with the amount at the mirror's storage scale, so values read
     * back from the database compare equal to values produced by a mapper.
     */
    public CanonicalEntity normalized() {
        if (amount == null || amount.scale() == AMOUNT_SCALE) {
            return this;
        }
        return toBuilder().amount(amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP)).build();
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
