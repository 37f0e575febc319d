package io.tradedesk.opsengine.timesheet;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Time entry, timesheet and engineer queries. A time entry is covered when it belongs to a
 * timesheet of the same tenant whose status is {@code submitted} or {@code approved}.
 */
public interface TimesheetRepository extends Repository<TimeEntry, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.timesheet.UnsubmittedTimeRecord(
          te.id, e.id, e.name, e.email, te.startedAt)
      FROM TimeEntry te
        JOIN Engineer e ON e.id = te.engineerId
        LEFT JOIN Timesheet ts ON ts.id = te.timesheetId AND ts.tenantId = :tenantId
      WHERE te.tenantId = :tenantId
        AND e.tenantId = :tenantId
        AND e.deletedAt IS NULL
        AND te.startedAt >= :since
        AND (ts.id IS NULL OR ts.status NOT IN ('submitted', 'approved'))
      ORDER BY te.startedAt ASC, te.id ASC
      """)
  List<UnsubmittedTimeRecord> findUnsubmittedSince(
      @Param("tenantId") String tenantId, @Param("since") Instant since, Pageable pageable);

  @Query(
      """
      SELECT DISTINCT te.jobId
      FROM TimeEntry te
        LEFT JOIN Timesheet ts ON ts.id = te.timesheetId AND ts.tenantId = :tenantId
      WHERE te.tenantId = :tenantId
        AND te.jobId IN :jobIds
        AND (ts.id IS NULL OR ts.status NOT IN ('submitted', 'approved'))
      """)
  List<UUID> findJobIdsWithUnsubmittedTime(
      @Param("tenantId") String tenantId, @Param("jobIds") Collection<UUID> jobIds);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.timesheet.EngineerRecord(e.id, e.name)
      FROM Engineer e
      WHERE e.tenantId = :tenantId AND e.deletedAt IS NULL
      ORDER BY e.name ASC, e.id ASC
      """)
  List<EngineerRecord> findEngineers(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.timesheet.EngineerLastActive(
          te.engineerId, MAX(COALESCE(te.endedAt, te.startedAt)))
      FROM TimeEntry te JOIN Engineer e ON e.id = te.engineerId
      WHERE te.tenantId = :tenantId AND e.tenantId = :tenantId AND e.deletedAt IS NULL
      GROUP BY te.engineerId
      """)
  List<EngineerLastActive> findLastActivePerEngineer(@Param("tenantId") String tenantId);

  @Query(
      """
      SELECT COUNT(ts) FROM Timesheet ts
      WHERE ts.tenantId = :tenantId AND ts.status = 'submitted'
      """)
  long countSubmitted(@Param("tenantId") String tenantId);
}
