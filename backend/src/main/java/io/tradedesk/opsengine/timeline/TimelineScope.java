package io.tradedesk.opsengine.timeline;

import io.tradedesk.opsengine.exception.InvalidStateException;

/** Entity a scoped timeline is built for. */
public enum TimelineScope {
  JOB("job"),
  CLIENT("client");

  private final String key;

  TimelineScope(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /**
   * Parses the {@code entityType} parameter; absent means job.
   *
   * @throws InvalidStateException for any other value
   */
  public static TimelineScope fromParameter(String entityType) {
    if (entityType == null || entityType.isBlank()) {
      return JOB;
    }
    for (TimelineScope scope : values()) {
      if (scope.key.equals(entityType)) {
        return scope;
      }
    }
    throw new InvalidStateException(
        "Invalid entity type", "Parameter 'entityType' must be 'job' or 'client'");
  }
}
