package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayName;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.timesheet.TimesheetSource;
import io.tradedesk.opsengine.timesheet.UnsubmittedTimeRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Engineer with time entries inside the lookback window that no submitted or approved timesheet
 * covers. One finding per engineer, triggered by their oldest uncovered entry.
 */
@Component
public class MissingTimesheetDetector implements AttentionDetector<UnsubmittedTimeRecord> {

  private final TimesheetSource timesheetSource;
  private final UrgencyPolicy urgencyPolicy;
  private final AttentionProperties properties;

  public MissingTimesheetDetector(
      TimesheetSource timesheetSource,
      UrgencyPolicy urgencyPolicy,
      AttentionProperties properties) {
    this.timesheetSource = timesheetSource;
    this.urgencyPolicy = urgencyPolicy;
    this.properties = properties;
  }

  @Override
  public AttentionType type() {
    return AttentionType.MISSING_TIMESHEET;
  }

  @Override
  public List<UnsubmittedTimeRecord> fetch(AttentionQuery query) {
    return timesheetSource.unsubmittedSince(
        query.tenantId(),
        query.now().minus(properties.timesheetLookback()),
        query.countingRowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<UnsubmittedTimeRecord> records, Instant now) {
    Instant since = now.minus(properties.timesheetLookback());
    Map<UUID, EngineerBacklog> byEngineer = new LinkedHashMap<>();
    for (UnsubmittedTimeRecord entry : records) {
      if (entry.startedAt() == null || entry.startedAt().isBefore(since)) {
        continue;
      }
      byEngineer.merge(
          entry.engineerId(), EngineerBacklog.of(entry), EngineerBacklog::combine);
    }

    String age = AgeText.lookback((int) properties.timesheetLookback().toDays());
    var findings = new ArrayList<AttentionFinding>();
    for (var backlog : byEngineer.entrySet()) {
      EngineerBacklog engineer = backlog.getValue();
      findings.add(
          new AttentionFinding(
              type(),
              backlog.getKey(),
              SafeText.format("%s has unsubmitted time entries", engineer.name()),
              age,
              urgencyPolicy.score(
                  type(), AgeText.daysBetween(engineer.oldestEntry(), now), engineer.entries()),
              engineer.oldestEntry()));
    }
    return findings;
  }

  private record EngineerBacklog(DisplayName name, Instant oldestEntry, long entries) {

    static EngineerBacklog of(UnsubmittedTimeRecord entry) {
      return new EngineerBacklog(
          DisplayName.firstOf(entry.engineerName(), entry.engineerEmail(), "Unknown engineer"),
          entry.startedAt(),
          1);
    }

    EngineerBacklog combine(EngineerBacklog other) {
      Instant oldest = other.oldestEntry.isBefore(oldestEntry) ? other.oldestEntry : oldestEntry;
      return new EngineerBacklog(name, oldest, entries + other.entries);
    }
  }
}
