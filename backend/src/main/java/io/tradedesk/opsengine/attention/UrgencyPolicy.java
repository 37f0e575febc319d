package io.tradedesk.opsengine.attention;

import org.springframework.stereotype.Component;

/** Scores findings with the configured {@link UrgencyRule} of their type. */
@Component
public class UrgencyPolicy {

  public static final int MIN_URGENCY = 0;
  public static final int MAX_URGENCY = 1000;

  private final AttentionProperties properties;

  public UrgencyPolicy(AttentionProperties properties) {
    this.properties = properties;
  }

  /**
   * @param days whole days the condition has held
   * @param items count of offending sub-items (open snags); zero where not applicable
   * @return the urgency, always within [{@value #MIN_URGENCY}, {@value #MAX_URGENCY}]
   */
  public int score(AttentionType type, long days, long items) {
    UrgencyRule rule = properties.urgency().get(type);
    if (rule == null) {
      throw new IllegalStateException("No urgency rule for " + type);
    }
    return clamp(rule.raw(Math.max(0, days), Math.max(0, items)));
  }

  static int clamp(long urgency) {
    return (int) Math.max(MIN_URGENCY, Math.min(MAX_URGENCY, urgency));
  }
}
