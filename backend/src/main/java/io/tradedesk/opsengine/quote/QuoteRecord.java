package io.tradedesk.opsengine.quote;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record QuoteRecord(
    UUID id,
    String quoteNumber,
    String clientName,
    String status,
    BigDecimal total,
    String currency,
    String token,
    Instant createdAt,
    Instant acceptedAt) {

  public static final String STATUS_ACCEPTED = "accepted";

  public boolean isAccepted() {
    return STATUS_ACCEPTED.equals(status) && acceptedAt != null;
  }
}
