package io.tradedesk.opsengine.attention;

/**
 * Linear urgency rule: {@code base + perDay * days + perItem * items}, capped at {@code max}.
 *
 * @param max ceiling for this rule; values of zero or below fall back to {@link
 *     UrgencyPolicy#MAX_URGENCY}
 */
public record UrgencyRule(int base, int perDay, int perItem, int max) {

  public UrgencyRule {
    max = max > 0 ? max : UrgencyPolicy.MAX_URGENCY;
  }

  public static UrgencyRule flat(int base) {
    return new UrgencyRule(base, 0, 0, UrgencyPolicy.MAX_URGENCY);
  }

  long raw(long days, long items) {
    return Math.min(base + perDay * days + perItem * items, max);
  }
}
