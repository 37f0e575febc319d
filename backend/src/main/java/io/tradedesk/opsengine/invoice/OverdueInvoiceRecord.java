package io.tradedesk.opsengine.invoice;

import java.time.Instant;
import java.util.UUID;

public record OverdueInvoiceRecord(
    UUID id, String invoiceNumber, String clientName, String status, Instant dueAt) {}
