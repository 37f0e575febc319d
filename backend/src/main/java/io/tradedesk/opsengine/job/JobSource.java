package io.tradedesk.opsengine.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Source adapter for jobs, their sites and snag items. Every method takes the tenant explicitly
 * and applies the caller's row cap.
 */
@Service
public class JobSource {

  private final JobRepository jobRepository;

  public JobSource(JobRepository jobRepository) {
    this.jobRepository = jobRepository;
  }

  @Transactional(readOnly = true)
  public List<CompletedJobRecord> completedWithoutInvoice(
      String tenantId, Instant completedBy, int rowCap) {
    return jobRepository.findCompletedWithoutInvoice(
        tenantId, completedBy, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<SnaggedJobRecord> completedWithOpenSnags(String tenantId, int rowCap) {
    return jobRepository.findCompletedWithOpenSnags(tenantId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public Optional<JobRecord> job(String tenantId, UUID jobId) {
    return jobRepository.findRecord(tenantId, jobId);
  }

  @Transactional(readOnly = true)
  public List<JobRecord> jobsForClient(String tenantId, UUID clientId, int rowCap) {
    return jobRepository.findRecordsForClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<JobRecord> recentlyUpdated(String tenantId, int rowCap) {
    return jobRepository.findRecentlyUpdated(tenantId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<UUID> jobIdsCreatedSince(String tenantId, Instant since, int rowCap) {
    return jobRepository.findIdsCreatedSince(tenantId, since, PageRequest.of(0, rowCap));
  }

  /** Those of {@code jobIds} with at least one open snag item. */
  @Transactional(readOnly = true)
  public List<UUID> jobIdsWithOpenSnags(String tenantId, Collection<UUID> jobIds) {
    if (jobIds.isEmpty()) {
      return List.of();
    }
    return jobRepository.findIdsWithOpenSnags(tenantId, jobIds);
  }

  @Transactional(readOnly = true)
  public List<JobPinRecord> openJobPins(String tenantId, int rowCap) {
    return jobRepository.findOpenPins(tenantId, PageRequest.of(0, rowCap));
  }

  /** Open job pins for the engineer whose login subject is {@code userId}. */
  @Transactional(readOnly = true)
  public List<JobPinRecord> openJobPinsAssignedTo(String tenantId, String userId, int rowCap) {
    return jobRepository.findOpenPinsAssignedTo(tenantId, userId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<ScheduledJobCount> scheduledJobCounts(String tenantId, Instant from, Instant to) {
    return jobRepository.countScheduledPerEngineer(tenantId, from, to);
  }

  @Transactional(readOnly = true)
  public List<JobStatusCount> countsByStatus(String tenantId) {
    return jobRepository.countByStatus(tenantId);
  }
}
