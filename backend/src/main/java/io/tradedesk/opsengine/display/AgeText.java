package io.tradedesk.opsengine.display;

import java.time.Duration;
import java.time.Instant;

/** Human-relative ages used in attention items. */
public final class AgeText {

  private AgeText() {}

  /** Whole days from {@code since} to {@code now}, never negative. */
  public static long daysBetween(Instant since, Instant now) {
    if (since == null || !since.isBefore(now)) {
      return 0;
    }
    return Duration.between(since, now).toDays();
  }

  /** "today", "1 day ago", "N days ago". */
  public static String ago(long days) {
    if (days <= 0) {
      return "today";
    }
    if (days == 1) {
      return "1 day ago";
    }
    return days + " days ago";
  }

  /** "due today", "1 day overdue", "N days overdue". */
  public static String overdue(long days) {
    if (days <= 0) {
      return "due today";
    }
    return days + (days == 1 ? " day overdue" : " days overdue");
  }

  /** "past N days". */
  public static String lookback(int days) {
    return "past " + days + (days == 1 ? " day" : " days");
  }
}
