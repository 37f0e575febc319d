package io.tradedesk.opsengine.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Read-only job queries. Every entity touched by a query, joined or sub-selected, is constrained
 * by {@code tenantId}; soft-deleted jobs and invoices are excluded.
 */
public interface JobRepository extends Repository<Job, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.CompletedJobRecord(
          j.id, j.jobNumber, COALESCE(j.completedAt, j.updatedAt))
      FROM Job j
      WHERE j.tenantId = :tenantId
        AND j.deletedAt IS NULL
        AND j.status = 'completed'
        AND COALESCE(j.completedAt, j.updatedAt) <= :completedBy
        AND NOT EXISTS (
          SELECT i.id FROM Invoice i
          WHERE i.jobId = j.id AND i.tenantId = :tenantId AND i.deletedAt IS NULL)
      ORDER BY COALESCE(j.completedAt, j.updatedAt) ASC, j.id ASC
      """)
  List<CompletedJobRecord> findCompletedWithoutInvoice(
      @Param("tenantId") String tenantId,
      @Param("completedBy") Instant completedBy,
      Pageable pageable);

  /** One row per completed job with open snags, oldest completion first. */
  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.SnaggedJobRecord(
          j.id, j.jobNumber, COALESCE(j.completedAt, j.updatedAt), COUNT(s))
      FROM SnagItem s JOIN Job j ON s.jobId = j.id
      WHERE s.tenantId = :tenantId
        AND j.tenantId = :tenantId
        AND s.status = 'open'
        AND j.status = 'completed'
        AND j.deletedAt IS NULL
      GROUP BY j.id, j.jobNumber, j.completedAt, j.updatedAt
      ORDER BY COALESCE(j.completedAt, j.updatedAt) ASC, j.id ASC
      """)
  List<SnaggedJobRecord> findCompletedWithOpenSnags(
      @Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobRecord(
          j.id, j.jobNumber, j.title, j.status, j.clientId, s.name, s.address1, s.city,
          j.createdAt, j.updatedAt, j.completedAt)
      FROM Job j LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE j.tenantId = :tenantId AND j.id = :id AND j.deletedAt IS NULL
      """)
  Optional<JobRecord> findRecord(@Param("tenantId") String tenantId, @Param("id") UUID id);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobRecord(
          j.id, j.jobNumber, j.title, j.status, j.clientId, s.name, s.address1, s.city,
          j.createdAt, j.updatedAt, j.completedAt)
      FROM Job j LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE j.tenantId = :tenantId AND j.clientId = :clientId AND j.deletedAt IS NULL
      ORDER BY j.createdAt DESC, j.id ASC
      """)
  List<JobRecord> findRecordsForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobRecord(
          j.id, j.jobNumber, j.title, j.status, j.clientId, s.name, s.address1, s.city,
          j.createdAt, j.updatedAt, j.completedAt)
      FROM Job j LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE j.tenantId = :tenantId AND j.deletedAt IS NULL
      ORDER BY j.updatedAt DESC, j.id ASC
      """)
  List<JobRecord> findRecentlyUpdated(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT j.id FROM Job j
      WHERE j.tenantId = :tenantId AND j.deletedAt IS NULL AND j.createdAt >= :since
      ORDER BY j.createdAt DESC, j.id ASC
      """)
  List<UUID> findIdsCreatedSince(
      @Param("tenantId") String tenantId, @Param("since") Instant since, Pageable pageable);

  @Query(
      """
      SELECT DISTINCT s.jobId FROM SnagItem s
      WHERE s.tenantId = :tenantId
        AND s.status = 'open'
        AND s.jobId IN :jobIds
      """)
  List<UUID> findIdsWithOpenSnags(
      @Param("tenantId") String tenantId, @Param("jobIds") Collection<UUID> jobIds);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobPinRecord(
          j.id, j.jobNumber, j.title, j.status, s.latitude, s.longitude)
      FROM Job j JOIN Site s ON s.id = j.siteId
      WHERE j.tenantId = :tenantId
        AND s.tenantId = :tenantId
        AND j.deletedAt IS NULL
        AND j.status NOT IN ('completed', 'closed', 'cancelled')
        AND s.latitude IS NOT NULL
        AND s.longitude IS NOT NULL
      ORDER BY j.createdAt DESC, j.id ASC
      """)
  List<JobPinRecord> findOpenPins(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobPinRecord(
          j.id, j.jobNumber, j.title, j.status, s.latitude, s.longitude)
      FROM Job j
        JOIN Site s ON s.id = j.siteId
        JOIN Engineer e ON e.id = j.assignedEngineerId
      WHERE j.tenantId = :tenantId
        AND s.tenantId = :tenantId
        AND e.tenantId = :tenantId
        AND e.userId = :userId
        AND j.deletedAt IS NULL
        AND j.status NOT IN ('completed', 'closed', 'cancelled')
        AND s.latitude IS NOT NULL
        AND s.longitude IS NOT NULL
      ORDER BY j.createdAt DESC, j.id ASC
      """)
  List<JobPinRecord> findOpenPinsAssignedTo(
      @Param("tenantId") String tenantId, @Param("userId") String userId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.ScheduledJobCount(j.assignedEngineerId, COUNT(j))
      FROM Job j
      WHERE j.tenantId = :tenantId
        AND j.deletedAt IS NULL
        AND j.assignedEngineerId IS NOT NULL
        AND j.status <> 'cancelled'
        AND j.scheduledStart >= :from
        AND j.scheduledStart < :to
      GROUP BY j.assignedEngineerId
      """)
  List<ScheduledJobCount> countScheduledPerEngineer(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.job.JobStatusCount(j.status, COUNT(j))
      FROM Job j
      WHERE j.tenantId = :tenantId AND j.deletedAt IS NULL
      GROUP BY j.status
      ORDER BY j.status ASC
      """)
  List<JobStatusCount> countByStatus(@Param("tenantId") String tenantId);
}
