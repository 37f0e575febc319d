package io.tradedesk.opsengine.audit;

import java.time.Instant;
import java.util.UUID;

public record AuditEventRecord(
    UUID id,
    String entityType,
    UUID entityId,
    String action,
    String actorName,
    String entityLabel,
    Instant occurredAt) {}
