package com.flagship.smart_sync.rail.quickbooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps QuickBooks Online entities to canonical form.
 *
 * Entity names on the QuickBooks side:
 * - BILL: Bill (open amount = Balance)
 * - INVOICE: Invoice (open amount = Balance)
 * - VENDOR / CUSTOMER: Vendor / Customer
 * - PAYMENT: BillPayment
 * - BALANCE: Account (amount = CurrentBalance)
 */
public class QuickBooksMapper {

    static final String STATUS_OPEN = "OPEN";
    static final String STATUS_PAID = "PAID";
    static final String STATUS_ACTIVE = "ACTIVE";
    static final String STATUS_INACTIVE = "INACTIVE";

    /**
     * QuickBooks entity name used in queries and in webhook payloads.
     */
    public static String qboEntityName(EntityType type) {
        return switch (type) {
            case BILL -> "Bill";
            case INVOICE -> "Invoice";
            case VENDOR -> "Vendor";
            case CUSTOMER -> "Customer";
            case PAYMENT -> "BillPayment";
            case BALANCE -> "Account";
        };
    }

    /**
     * Reverse of {@link #qboEntityName}; null for entities that are not mirrored.
     */
    public static EntityType fromQboEntityName(String name) {
        if (name == null) {
            return null;
        }
        for (EntityType type : EntityType.values()) {
            if (qboEntityName(type).equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Wraps a native QuickBooks object as a rail record, reading id, SyncToken and
     * MetaData.LastUpdatedTime.
     */
    public RailRecord toRecord(JsonNode node) {
        String id = text(node, "Id");
        if (id == null) {
            throw new MappingError(null, "QuickBooks object without Id");
        }
        Instant lastUpdated = parseInstant(id, node.path("MetaData").path("LastUpdatedTime").asText(null));
        return new RailRecord(id, text(node, "SyncToken"), lastUpdated, node);
    }

    public CanonicalEntity map(EntityType type, RailRecord record) {
        JsonNode node = record.getPayload();
        String id = record.getExternalId();
        if (node == null || !node.isObject()) {
            throw new MappingError(id, "QuickBooks " + qboEntityName(type) + " payload is not an object");
        }

        CanonicalEntity.CanonicalEntityBuilder builder = CanonicalEntity.builder()
                .entityType(type)
                .externalId(id)
                .sourceVersion(record.getSourceVersion())
                .currency(node.path("CurrencyRef").path("value").asText(null));

        switch (type) {
            case BILL -> mapBill(node, id, builder);
            case INVOICE -> mapInvoice(node, id, builder);
            case VENDOR, CUSTOMER -> mapParty(node, id, builder);
            case PAYMENT -> mapBillPayment(node, id, builder);
            case BALANCE -> mapAccount(node, id, builder);
        }
        return builder.build().normalized();
    }

    private void mapBill(JsonNode node, String id, CanonicalEntity.CanonicalEntityBuilder builder) {
        BigDecimal balance = decimal(node, id, "Balance");
        BigDecimal total = decimal(node, id, "TotalAmt");
        BigDecimal open = balance != null ? balance : total;
        if (open == null) {
            throw new MappingError(id, "Bill has neither Balance nor TotalAmt");
        }

        JsonNode vendorRef = node.path("VendorRef");
        builder.counterpartyName(vendorRef.path("name").asText(null))
                .amount(open)
                .dueDate(date(node, id, "DueDate"))
                .status(open.signum() == 0 ? STATUS_PAID : STATUS_OPEN);

        putIfPresent(builder, "vendor_id", vendorRef.path("value").asText(null));
        putIfPresent(builder, "doc_number", text(node, "DocNumber"));
        putIfPresent(builder, "txn_date", text(node, "TxnDate"));
        putIfPresent(builder, "total_amount", total == null ? null : total.toPlainString());
    }

    private void mapInvoice(JsonNode node, String id, CanonicalEntity.CanonicalEntityBuilder builder) {
        BigDecimal balance = decimal(node, id, "Balance");
        BigDecimal total = decimal(node, id, "TotalAmt");
        BigDecimal open = balance != null ? balance : total;
        if (open == null) {
            throw new MappingError(id, "Invoice has neither Balance nor TotalAmt");
        }

        JsonNode customerRef = node.path("CustomerRef");
        builder.counterpartyName(customerRef.path("name").asText(null))
                .amount(open)
                .dueDate(date(node, id, "DueDate"))
                .status(open.signum() == 0 ? STATUS_PAID : STATUS_OPEN);

        putIfPresent(builder, "customer_id", customerRef.path("value").asText(null));
        putIfPresent(builder, "doc_number", text(node, "DocNumber"));
        putIfPresent(builder, "txn_date", text(node, "TxnDate"));
        putIfPresent(builder, "email_status", text(node, "EmailStatus"));
        putIfPresent(builder, "total_amount", total == null ? null : total.toPlainString());
    }

    private void mapParty(JsonNode node, String id, CanonicalEntity.CanonicalEntityBuilder builder) {
        String name = text(node, "DisplayName");
        if (name == null) {
            throw new MappingError(id, "Party without DisplayName");
        }
        builder.counterpartyName(name)
                .amount(decimal(node, id, "Balance"))
                .status(node.path("Active").asBoolean(true) ? STATUS_ACTIVE : STATUS_INACTIVE);

        putIfPresent(builder, "email", node.path("PrimaryEmailAddr").path("Address").asText(null));
        putIfPresent(builder, "company_name", text(node, "CompanyName"));
    }

    private void mapBillPayment(JsonNode node, String id, CanonicalEntity.CanonicalEntityBuilder builder) {
        BigDecimal total = decimal(node, id, "TotalAmt");
        if (total == null) {
            throw new MappingError(id, "BillPayment without TotalAmt");
        }
        JsonNode vendorRef = node.path("VendorRef");
        builder.counterpartyName(vendorRef.path("name").asText(null))
                .amount(total)
                .status(STATUS_PAID);

        putIfPresent(builder, "vendor_id", vendorRef.path("value").asText(null));
        putIfPresent(builder, "pay_type", text(node, "PayType"));
        putIfPresent(builder, "txn_date", text(node, "TxnDate"));

        List<String> billIds = new ArrayList<>();
        for (JsonNode line : node.path("Line")) {
            for (JsonNode linked : line.path("LinkedTxn")) {
                if ("Bill".equals(linked.path("TxnType").asText())) {
                    billIds.add(linked.path("TxnId").asText());
                }
            }
        }
        if (!billIds.isEmpty()) {
            builder.attribute("linked_bill_ids", String.join(",", billIds));
        }
    }

    private void mapAccount(JsonNode node, String id, CanonicalEntity.CanonicalEntityBuilder builder) {
        String name = text(node, "Name");
        String accountType = text(node, "AccountType");
        if (name == null || accountType == null) {
            throw new MappingError(id, "Account without Name or AccountType");
        }
        BigDecimal balance = decimal(node, id, "CurrentBalance");
        builder.counterpartyName(name)
                .amount(balance == null ? BigDecimal.ZERO : balance)
                .status(node.path("Active").asBoolean(true) ? STATUS_ACTIVE : STATUS_INACTIVE)
                .attribute("account_type", accountType);

        putIfPresent(builder, "account_sub_type", text(node, "AccountSubType"));
    }

    private static void putIfPresent(CanonicalEntity.CanonicalEntityBuilder builder, String name, String value) {
        if (value != null && !value.isBlank()) {
            builder.attribute(name, value);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static BigDecimal decimal(JsonNode node, String id, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MappingError(id, field + " is not a number: " + value.asText(), e);
        }
    }

    private static LocalDate date(JsonNode node, String id, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new MappingError(id, field + " is not a date: " + value, e);
        }
    }

    private static Instant parseInstant(String id, String value) {
        if (value == null) {
            throw new MappingError(id, "QuickBooks object without MetaData.LastUpdatedTime");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new MappingError(id, "Unreadable LastUpdatedTime: " + value, e);
        }
    }
}
