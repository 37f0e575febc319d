package io.tradedesk.opsengine.display;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AgeTextTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  @Test
  void daysBetweenCountsWholeDaysOnly() {
    assertThat(AgeText.daysBetween(NOW.minus(Duration.ofHours(47)), NOW)).isEqualTo(1);
    assertThat(AgeText.daysBetween(NOW.minus(Duration.ofDays(3)), NOW)).isEqualTo(3);
  }

  @Test
  void futureOrMissingInstantIsZeroDays() {
    assertThat(AgeText.daysBetween(NOW.plusSeconds(5), NOW)).isZero();
    assertThat(AgeText.daysBetween(null, NOW)).isZero();
  }

  @Test
  void relativePhrases() {
    assertThat(AgeText.ago(0)).isEqualTo("today");
    assertThat(AgeText.ago(1)).isEqualTo("1 day ago");
    assertThat(AgeText.ago(12)).isEqualTo("12 days ago");
    assertThat(AgeText.overdue(0)).isEqualTo("due today");
    assertThat(AgeText.overdue(1)).isEqualTo("1 day overdue");
    assertThat(AgeText.overdue(5)).isEqualTo("5 days overdue");
    assertThat(AgeText.lookback(7)).isEqualTo("past 7 days");
  }
}
