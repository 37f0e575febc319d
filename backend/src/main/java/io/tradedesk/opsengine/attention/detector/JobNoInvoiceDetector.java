package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.job.CompletedJobRecord;
import io.tradedesk.opsengine.job.JobSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Job completed at least {@code ops.attention.job-no-invoice-after} ago with no live invoice. */
@Component
public class JobNoInvoiceDetector implements AttentionDetector<CompletedJobRecord> {

  private final JobSource jobSource;
  private final UrgencyPolicy urgencyPolicy;
  private final AttentionProperties properties;

  public JobNoInvoiceDetector(
      JobSource jobSource, UrgencyPolicy urgencyPolicy, AttentionProperties properties) {
    this.jobSource = jobSource;
    this.urgencyPolicy = urgencyPolicy;
    this.properties = properties;
  }

  @Override
  public AttentionType type() {
    return AttentionType.JOB_NO_INVOICE;
  }

  @Override
  public List<CompletedJobRecord> fetch(AttentionQuery query) {
    return jobSource.completedWithoutInvoice(
        query.tenantId(), query.now().minus(properties.jobNoInvoiceAfter()), query.rowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<CompletedJobRecord> records, Instant now) {
    Instant cutoff = now.minus(properties.jobNoInvoiceAfter());
    var findings = new ArrayList<AttentionFinding>();
    for (CompletedJobRecord job : records) {
      if (job.completedAt() == null || job.completedAt().isAfter(cutoff)) {
        continue;
      }
      long days = AgeText.daysBetween(job.completedAt(), now);
      findings.add(
          new AttentionFinding(
              type(),
              job.id(),
              SafeText.format(
                  "Job #%s completed, no invoice created", DisplayRef.of(job.jobNumber(), job.id())),
              AgeText.ago(days),
              urgencyPolicy.score(type(), days, 0),
              job.completedAt()));
    }
    return findings;
  }
}
