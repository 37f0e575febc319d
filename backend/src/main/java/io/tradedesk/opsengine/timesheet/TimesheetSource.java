package io.tradedesk.opsengine.timesheet;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Source adapter for engineers, their time entries and weekly timesheets. */
@Service
public class TimesheetSource {

  private final TimesheetRepository timesheetRepository;

  public TimesheetSource(TimesheetRepository timesheetRepository) {
    this.timesheetRepository = timesheetRepository;
  }

  @Transactional(readOnly = true)
  public List<UnsubmittedTimeRecord> unsubmittedSince(String tenantId, Instant since, int rowCap) {
    return timesheetRepository.findUnsubmittedSince(tenantId, since, PageRequest.of(0, rowCap));
  }

  /** Those of {@code jobIds} with time booked outside a submitted or approved timesheet. */
  @Transactional(readOnly = true)
  public List<UUID> jobIdsWithUnsubmittedTime(String tenantId, Collection<UUID> jobIds) {
    if (jobIds.isEmpty()) {
      return List.of();
    }
    return timesheetRepository.findJobIdsWithUnsubmittedTime(tenantId, jobIds);
  }

  @Transactional(readOnly = true)
  public List<EngineerRecord> engineers(String tenantId, int rowCap) {
    return timesheetRepository.findEngineers(tenantId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<EngineerLastActive> lastActive(String tenantId) {
    return timesheetRepository.findLastActivePerEngineer(tenantId);
  }

  /** Timesheets submitted and waiting for approval. */
  @Transactional(readOnly = true)
  public long submittedCount(String tenantId) {
    return timesheetRepository.countSubmitted(tenantId);
  }
}
