package io.tradedesk.opsengine.attention;

import io.tradedesk.opsengine.display.SafeText;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Raw output of a detector, before it is rendered into an {@link AttentionItem}.
 *
 * @param entityId the entity the condition holds for (invoice, job, engineer, ...)
 * @param triggeredAt instant the condition started from; older findings win urgency ties
 */
public record AttentionFinding(
    AttentionType type,
    UUID entityId,
    SafeText message,
    String age,
    int urgency,
    Instant triggeredAt) {

  public AttentionFinding {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(triggeredAt, "triggeredAt");
  }

  /** Unique per detector and entity: {@code <type>_<entityId>}. */
  public String id() {
    return type.key() + "_" + entityId;
  }
}
