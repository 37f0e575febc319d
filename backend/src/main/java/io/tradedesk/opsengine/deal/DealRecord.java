package io.tradedesk.opsengine.deal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record DealRecord(
    UUID id,
    String title,
    String stage,
    BigDecimal value,
    String currency,
    Instant stageChangedAt,
    Instant createdAt) {

  public Instant changedAt() {
    return stageChangedAt != null ? stageChangedAt : createdAt;
  }
}
