package io.tradedesk.opsengine.timeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.tradedesk.opsengine.display.SafeText;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One fact on a timeline. {@code id} is prefixed by the fact's source ({@code job-}, {@code
 * inv-paid-}, ...) so facts derived from the same record never collide. Optional fields are left
 * out of the JSON when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityItem(
    String id,
    Instant timestamp,
    ActivityKind kind,
    SafeText title,
    SafeText subtitle,
    String status,
    BigDecimal amount,
    String currency,
    String link,
    String documentLink) {

  public ActivityItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(title, "title");
  }
}
