package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayField;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.job.JobSource;
import io.tradedesk.opsengine.job.SnaggedJobRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Completed job with unresolved snag items. One finding per job; urgency scales with count. */
@Component
public class OpenSnagsDetector implements AttentionDetector<SnaggedJobRecord> {

  private final JobSource jobSource;
  private final UrgencyPolicy urgencyPolicy;

  public OpenSnagsDetector(JobSource jobSource, UrgencyPolicy urgencyPolicy) {
    this.jobSource = jobSource;
    this.urgencyPolicy = urgencyPolicy;
  }

  @Override
  public AttentionType type() {
    return AttentionType.OPEN_SNAGS;
  }

  /** Rows are already one per job, so the cap limits jobs rather than snag items. */
  @Override
  public List<SnaggedJobRecord> fetch(AttentionQuery query) {
    return jobSource.completedWithOpenSnags(query.tenantId(), query.rowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<SnaggedJobRecord> records, Instant now) {
    var findings = new ArrayList<AttentionFinding>();
    for (SnaggedJobRecord job : records) {
      if (job.openSnags() <= 0) {
        continue;
      }
      long days = AgeText.daysBetween(job.jobCompletedAt(), now);
      var ref = new DisplayField[] {DisplayRef.of(job.jobNumber(), job.jobId())};
      SafeText message =
          job.openSnags() == 1
              ? SafeText.format("Job #%s has 1 open snag", ref)
              : SafeText.formatCounts("Job #%s has %d open snags", ref, job.openSnags());
      findings.add(
          new AttentionFinding(
              type(),
              job.jobId(),
              message,
              AgeText.ago(days),
              urgencyPolicy.score(type(), days, job.openSnags()),
              job.jobCompletedAt() != null ? job.jobCompletedAt() : now));
    }
    return findings;
  }
}
