package io.tradedesk.opsengine.attention.detector;

import static org.assertj.core.api.Assertions.assertThat;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.certificate.UnissuedCertificateRecord;
import io.tradedesk.opsengine.invoice.OverdueInvoiceRecord;
import io.tradedesk.opsengine.job.CompletedJobRecord;
import io.tradedesk.opsengine.job.SnaggedJobRecord;
import io.tradedesk.opsengine.quote.AcceptedQuoteRecord;
import io.tradedesk.opsengine.timesheet.UnsubmittedTimeRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AttentionDetectorsTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private final AttentionProperties properties = AttentionProperties.defaults();
  private final UrgencyPolicy urgencyPolicy = new UrgencyPolicy(properties);

  private static Instant daysAgo(long days) {
    return NOW.minus(Duration.ofDays(days));
  }

  @Test
  void overdueInvoiceScoresByDaysOverdue() {
    var detector = new InvoiceOverdueDetector(null, urgencyPolicy);
    UUID id = UUID.randomUUID();

    List<AttentionFinding> findings =
        detector.detect(
            List.of(new OverdueInvoiceRecord(id, "INV-0042", "Acme Ltd", "sent", daysAgo(5))),
            NOW);

    assertThat(findings).hasSize(1);
    AttentionFinding finding = findings.get(0);
    assertThat(finding.id()).isEqualTo("invoice_overdue_" + id);
    assertThat(finding.message().value()).isEqualTo("Invoice #INV-0042 to Acme Ltd is overdue");
    assertThat(finding.age()).isEqualTo("5 days overdue");
    assertThat(finding.urgency()).isEqualTo(350);
  }

  @Test
  void invoiceNotYetDueIsIgnored() {
    var detector = new InvoiceOverdueDetector(null, urgencyPolicy);

    var findings =
        detector.detect(
            List.of(
                new OverdueInvoiceRecord(
                    UUID.randomUUID(), "INV-1", "Acme", "sent", NOW.plusSeconds(60))),
            NOW);

    assertThat(findings).isEmpty();
  }

  @Test
  void invoiceWithoutNumberFallsBackToShortReference() {
    var detector = new InvoiceOverdueDetector(null, urgencyPolicy);
    UUID id = UUID.fromString("3f2a9c1e-0000-4000-8000-000000000001");

    var findings =
        detector.detect(List.of(new OverdueInvoiceRecord(id, null, null, "sent", daysAgo(1))), NOW);

    assertThat(findings.get(0).message().value())
        .isEqualTo("Invoice #3f2a9c1e to a client is overdue")
        .doesNotContain(id.toString());
  }

  @Test
  void jobCompletedAtThresholdIsFlagged() {
    var detector = new JobNoInvoiceDetector(null, urgencyPolicy, properties);
    UUID atThreshold = UUID.randomUUID();
    UUID tooRecent = UUID.randomUUID();

    var findings =
        detector.detect(
            List.of(
                new CompletedJobRecord(atThreshold, "J-1007", daysAgo(3)),
                new CompletedJobRecord(tooRecent, "J-1008", daysAgo(1))),
            NOW);

    assertThat(findings).extracting(AttentionFinding::entityId).containsExactly(atThreshold);
    assertThat(findings.get(0).message().value())
        .isEqualTo("Job #J-1007 completed, no invoice created");
    assertThat(findings.get(0).age()).isEqualTo("3 days ago");
    assertThat(findings.get(0).urgency()).isEqualTo(215);
  }

  @Test
  void jobUrgencyIsCappedByRuleMaximum() {
    var detector = new JobNoInvoiceDetector(null, urgencyPolicy, properties);

    var findings =
        detector.detect(
            List.of(new CompletedJobRecord(UUID.randomUUID(), "J-1", daysAgo(400))), NOW);

    assertThat(findings.get(0).urgency()).isEqualTo(700);
  }

  @Test
  void openSnagsProduceOneFindingPerJobScoredByCount() {
    var detector = new OpenSnagsDetector(null, urgencyPolicy);
    Instant completed = daysAgo(2);

    var findings =
        detector.detect(
            List.of(
                new SnaggedJobRecord(UUID.randomUUID(), "J-1", completed, 3),
                new SnaggedJobRecord(UUID.randomUUID(), "J-2", completed, 1)),
            NOW);

    assertThat(findings).hasSize(2);
    assertThat(findings.get(0).message().value()).isEqualTo("Job #J-1 has 3 open snags");
    assertThat(findings.get(0).urgency()).isEqualTo(100 + 2 + 75);
    assertThat(findings.get(1).message().value()).isEqualTo("Job #J-2 has 1 open snag");
    assertThat(findings.get(1).urgency()).isEqualTo(100 + 2 + 25);
  }

  @Test
  void moreOpenSnagsNeverScoreLowerAtTheSameAge() {
    var detector = new OpenSnagsDetector(null, urgencyPolicy);
    Instant completed = daysAgo(10);

    var findings =
        detector.detect(
            List.of(
                new SnaggedJobRecord(UUID.randomUUID(), "J-1", completed, 4),
                new SnaggedJobRecord(UUID.randomUUID(), "J-2", completed, 5)),
            NOW);

    assertThat(findings.get(1).urgency()).isGreaterThan(findings.get(0).urgency());
  }

  @Test
  void jobsWithoutOpenSnagsAreSkipped() {
    var detector = new OpenSnagsDetector(null, urgencyPolicy);

    var findings =
        detector.detect(List.of(new SnaggedJobRecord(UUID.randomUUID(), "J-1", daysAgo(1), 0)), NOW);

    assertThat(findings).isEmpty();
  }

  @Test
  void missingTimesheetProducesOneFindingPerEngineer() {
    var detector = new MissingTimesheetDetector(null, urgencyPolicy, properties);
    UUID engineer = UUID.randomUUID();

    var findings =
        detector.detect(
            List.of(
                new UnsubmittedTimeRecord(
                    UUID.randomUUID(), engineer, "Sam Spark", "sam@example.com", daysAgo(2)),
                new UnsubmittedTimeRecord(
                    UUID.randomUUID(), engineer, "Sam Spark", "sam@example.com", daysAgo(4)),
                new UnsubmittedTimeRecord(
                    UUID.randomUUID(), engineer, "Sam Spark", "sam@example.com", daysAgo(9))),
            NOW);

    assertThat(findings).hasSize(1);
    AttentionFinding finding = findings.get(0);
    assertThat(finding.type()).isEqualTo(AttentionType.MISSING_TIMESHEET);
    assertThat(finding.entityId()).isEqualTo(engineer);
    assertThat(finding.message().value()).isEqualTo("Sam Spark has unsubmitted time entries");
    assertThat(finding.age()).isEqualTo("past 7 days");
    assertThat(finding.urgency()).isEqualTo(50);
    assertThat(finding.triggeredAt()).isEqualTo(daysAgo(4));
  }

  @Test
  void missingTimesheetFallsBackToEmailThenPlaceholder() {
    var detector = new MissingTimesheetDetector(null, urgencyPolicy, properties);

    var findings =
        detector.detect(
            List.of(
                new UnsubmittedTimeRecord(
                    UUID.randomUUID(), UUID.randomUUID(), " ", "pat@example.com", daysAgo(1)),
                new UnsubmittedTimeRecord(
                    UUID.randomUUID(), UUID.randomUUID(), null, null, daysAgo(1))),
            NOW);

    assertThat(findings)
        .extracting(f -> f.message().value())
        .containsExactly(
            "pat@example.com has unsubmitted time entries",
            "Unknown engineer has unsubmitted time entries");
  }

  @Test
  void certificateCompletedBeforeThresholdIsFlagged() {
    var detector = new CertNotIssuedDetector(null, urgencyPolicy, properties);
    UUID id = UUID.randomUUID();

    var findings =
        detector.detect(
            List.of(
                new UnissuedCertificateRecord(id, "EICR-77", daysAgo(3)),
                new UnissuedCertificateRecord(UUID.randomUUID(), "EICR-78", NOW.minusSeconds(60))),
            NOW);

    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).message().value())
        .isEqualTo("Certificate #EICR-77 completed, not yet issued");
    assertThat(findings.get(0).urgency()).isEqualTo(165);
  }

  @Test
  void acceptedQuoteWithoutJobIsFlagged() {
    var detector = new QuoteNoJobDetector(null, urgencyPolicy, properties);

    var findings =
        detector.detect(
            List.of(new AcceptedQuoteRecord(UUID.randomUUID(), "Q-12", daysAgo(10))), NOW);

    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).message().value()).isEqualTo("Quote #Q-12 accepted, no job created");
    assertThat(findings.get(0).age()).isEqualTo("10 days ago");
    assertThat(findings.get(0).urgency()).isEqualTo(200);
  }
}
