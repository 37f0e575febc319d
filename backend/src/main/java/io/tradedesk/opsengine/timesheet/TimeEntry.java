package io.tradedesk.opsengine.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Clocked work by an engineer, optionally against a job. Grouped weekly into a timesheet. */
@Entity
@Immutable
@Table(name = "time_entries")
public class TimeEntry {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "engineer_id", nullable = false)
  private UUID engineerId;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "timesheet_id")
  private UUID timesheetId;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column(name = "ended_at")
  private Instant endedAt;

  protected TimeEntry() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getEngineerId() {
    return engineerId;
  }

  public UUID getJobId() {
    return jobId;
  }

  public UUID getTimesheetId() {
    return timesheetId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getEndedAt() {
    return endedAt;
  }
}
