package io.tradedesk.opsengine.attention;

import static org.assertj.core.api.Assertions.assertThat;

import io.tradedesk.opsengine.display.SafeText;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class AttentionRankerTest {

  private static final Instant BASE = Instant.parse("2026-03-01T00:00:00Z");

  private static AttentionFinding finding(
      AttentionType type, UUID entityId, int urgency, Instant triggeredAt) {
    return new AttentionFinding(
        type, entityId, SafeText.constant("message"), "today", urgency, triggeredAt);
  }

  @Test
  void sortsByUrgencyThenOldestTrigger() {
    var low = finding(AttentionType.QUOTE_NO_JOB, UUID.randomUUID(), 150, BASE);
    var highNewer = finding(AttentionType.INVOICE_OVERDUE, UUID.randomUUID(), 400, BASE.plusSeconds(60));
    var highOlder = finding(AttentionType.JOB_NO_INVOICE, UUID.randomUUID(), 400, BASE);

    var ranked = AttentionRanker.rank(List.of(low, highNewer, highOlder), 6);

    assertThat(ranked).containsExactly(highOlder, highNewer, low);
  }

  @Test
  void equalUrgencyAndTriggerFallBackToId() {
    UUID entity = UUID.fromString("00000000-0000-4000-8000-000000000001");
    var snags = finding(AttentionType.OPEN_SNAGS, entity, 200, BASE);
    var invoice = finding(AttentionType.JOB_NO_INVOICE, entity, 200, BASE);

    var ranked = AttentionRanker.rank(List.of(snags, invoice), 6);

    assertThat(ranked).extracting(AttentionFinding::id)
        .containsExactly("job_no_invoice_" + entity, "open_snags_" + entity);
  }

  @Test
  void capsTheResult() {
    var findings =
        IntStream.range(0, 10)
            .mapToObj(i -> finding(AttentionType.INVOICE_OVERDUE, UUID.randomUUID(), 300 + i, BASE))
            .toList();

    var ranked = AttentionRanker.rank(findings, 6);

    assertThat(ranked).hasSize(6);
    assertThat(ranked.get(0).urgency()).isEqualTo(309);
    assertThat(ranked.get(5).urgency()).isEqualTo(304);
  }

  @Test
  void duplicateIdsKeepHighestRanked() {
    UUID entity = UUID.randomUUID();
    var weaker = finding(AttentionType.INVOICE_OVERDUE, entity, 310, BASE);
    var stronger = finding(AttentionType.INVOICE_OVERDUE, entity, 320, BASE);

    var ranked = AttentionRanker.rank(List.of(weaker, stronger), 6);

    assertThat(ranked).containsExactly(stronger);
  }

  @Test
  void rankingIsIndependentOfInputOrder() {
    var a = finding(AttentionType.INVOICE_OVERDUE, UUID.randomUUID(), 350, BASE);
    var b = finding(AttentionType.CERT_NOT_ISSUED, UUID.randomUUID(), 165, BASE);
    var c = finding(AttentionType.MISSING_TIMESHEET, UUID.randomUUID(), 50, BASE);

    assertThat(AttentionRanker.rank(List.of(c, a, b), 6))
        .isEqualTo(AttentionRanker.rank(List.of(b, c, a), 6));
  }

  @Test
  void emptyInputRanksToEmpty() {
    assertThat(AttentionRanker.rank(List.of(), 6)).isEmpty();
  }
}
