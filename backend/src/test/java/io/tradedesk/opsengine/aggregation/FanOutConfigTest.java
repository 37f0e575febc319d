package io.tradedesk.opsengine.aggregation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.hibernate.jpa.SpecHints;
import org.junit.jupiter.api.Test;

class FanOutConfigTest {

  @Test
  void queryTimeoutFollowsTheSourceDeadline() {
    var properties = new SourceProperties(Duration.ofSeconds(3), 50, 500, 4, 10);
    Map<String, Object> hibernateProperties = new HashMap<>();

    new FanOutConfig().sourceQueryTimeoutCustomizer(properties).customize(hibernateProperties);

    assertThat(hibernateProperties).containsEntry(SpecHints.HINT_SPEC_QUERY_TIMEOUT, 3000);
  }

  @Test
  void subSecondDeadlinesRoundUpToWholeSeconds() {
    assertThat(FanOutConfig.queryTimeoutMillis(Duration.ofMillis(800))).isEqualTo(1000);
    assertThat(FanOutConfig.queryTimeoutMillis(Duration.ofMillis(1500))).isEqualTo(2000);
    assertThat(FanOutConfig.queryTimeoutMillis(Duration.ZERO)).isEqualTo(1000);
  }
}
