package com.flagship.smart_sync.rail.ramp;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps Ramp bills and vendors to canonical form. Ramp amounts are integer minor units.
 */
public class RampMapper {

    private static final int MINOR_UNIT_SCALE = 2;

    public RailRecord toRecord(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            throw new MappingError(null, "Ramp object without id");
        }
        String updatedAt = text(node, "updated_at");
        Instant lastUpdated = updatedAt != null ? parseInstant(id, updatedAt) : parseInstant(id, text(node, "created_at"));
        return new RailRecord(id, updatedAt, lastUpdated, node);
    }

    public CanonicalEntity map(EntityType type, RailRecord record) {
        JsonNode node = record.getPayload();
        String id = record.getExternalId();
        if (node == null || !node.isObject()) {
            throw new MappingError(id, "Ramp payload is not an object");
        }
        return switch (type) {
            case BILL -> mapBill(node, record);
            case VENDOR -> mapVendor(node, record);
            default -> throw new MappingError(id, "Ramp does not provide " + type);
        };
    }

    private CanonicalEntity mapBill(JsonNode node, RailRecord record) {
        String id = record.getExternalId();
        JsonNode amount = node.path("amount");
        if (!amount.has("amount")) {
            throw new MappingError(id, "Ramp bill without amount");
        }

        CanonicalEntity.CanonicalEntityBuilder builder = CanonicalEntity.builder()
                .entityType(EntityType.BILL)
                .externalId(id)
                .sourceVersion(record.getSourceVersion())
                .counterpartyName(node.path("vendor").path("remote_name").asText(null))
                .amount(fromMinorUnits(id, amount.get("amount")))
                .currency(amount.path("currency_code").asText(null))
                .dueDate(date(id, text(node, "due_at")))
                .status(billStatus(node));

        String vendorId = node.path("vendor").path("id").asText(null);
        if (vendorId != null) {
            builder.attribute("vendor_id", vendorId);
        }
        String invoiceNumber = text(node, "invoice_number");
        if (invoiceNumber != null) {
            builder.attribute("doc_number", invoiceNumber);
        }
        String paymentStatus = text(node, "payment_status");
        if (paymentStatus != null) {
            builder.attribute("payment_status", paymentStatus);
        }
        return builder.build().normalized();
    }

    private CanonicalEntity mapVendor(JsonNode node, RailRecord record) {
        String id = record.getExternalId();
        String name = text(node, "name");
        if (name == null) {
            throw new MappingError(id, "Ramp vendor without name");
        }
        return CanonicalEntity.builder()
                .entityType(EntityType.VENDOR)
                .externalId(id)
                .sourceVersion(record.getSourceVersion())
                .counterpartyName(name)
                .status(node.path("is_active").asBoolean(true) ? "ACTIVE" : "INACTIVE")
                .build();
    }

    /**
     * Body for creating a bill on Ramp from a local bill.
     */
    public Map<String, Object> toCreateBillBody(CanonicalEntity bill) {
        String vendorId = bill.attribute("vendor_id");
        if (vendorId == null) {
            throw new IllegalStateException("Bill has no vendor_id and cannot be sent to Ramp");
        }
        if (bill.getAmount() == null || bill.getAmount().signum() <= 0) {
            throw new IllegalStateException("Bill amount must be positive to be sent to Ramp");
        }

        Map<String, Object> amount = new LinkedHashMap<>();
        amount.put("amount", toMinorUnits(bill.getAmount()));
        amount.put("currency_code", bill.getCurrency() == null ? "USD" : bill.getCurrency());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vendor_id", vendorId);
        body.put("amount", amount);
        if (bill.getDueDate() != null) {
            body.put("due_at", bill.getDueDate().toString());
        }
        if (bill.attribute("doc_number") != null) {
            body.put("invoice_number", bill.attribute("doc_number"));
        }
        return body;
    }

    private static String billStatus(JsonNode node) {
        String paymentStatus = node.path("payment_status").asText("");
        if ("PAID".equalsIgnoreCase(paymentStatus)) {
            return "PAID";
        }
        if ("SCHEDULED".equalsIgnoreCase(paymentStatus) || "PROCESSING".equalsIgnoreCase(paymentStatus)) {
            return "SCHEDULED";
        }
        String status = node.path("status").asText("OPEN");
        return status.toUpperCase(Locale.ROOT);
    }

    static BigDecimal fromMinorUnits(String id, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new MappingError(id, "Ramp amount is not an integer: " + value);
        }
        return new BigDecimal(BigInteger.valueOf(value.asLong()), MINOR_UNIT_SCALE);
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(MINOR_UNIT_SCALE).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static LocalDate date(String id, String value) {
        if (value == null) {
            return null;
        }
        try {
            // due_at may be a date or a timestamp
            return value.length() > 10 ? OffsetDateTime.parse(value).toLocalDate() : LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new MappingError(id, "Unreadable due_at: " + value, e);
        }
    }

    private static Instant parseInstant(String id, String value) {
        if (value == null) {
            throw new MappingError(id, "Ramp object without timestamps");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new MappingError(id, "Unreadable timestamp: " + value, e);
        }
    }
}
