package io.tradedesk.opsengine.job;

import java.time.Instant;
import java.util.UUID;

/** Timeline projection of a job with its site address. */
public record JobRecord(
    UUID id,
    String jobNumber,
    String title,
    String status,
    UUID clientId,
    String siteName,
    String siteAddress,
    String siteCity,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt) {

  /** Completion instant, falling back to the last update for jobs closed without one. */
  public Instant finishedAt() {
    return completedAt != null ? completedAt : updatedAt;
  }
}
