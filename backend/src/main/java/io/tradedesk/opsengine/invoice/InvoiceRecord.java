package io.tradedesk.opsengine.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Timeline projection of an invoice. */
public record InvoiceRecord(
    UUID id,
    String invoiceNumber,
    String clientName,
    String status,
    BigDecimal total,
    String currency,
    String token,
    Instant issuedAt,
    Instant createdAt,
    Instant paidAt) {

  public static final String STATUS_PAID = "paid";

  public Instant issuedOrCreatedAt() {
    return issuedAt != null ? issuedAt : createdAt;
  }

  public boolean isPaid() {
    return STATUS_PAID.equals(status) && paidAt != null;
  }
}
