package io.tradedesk.opsengine.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Weekly timesheet. Entries count as covered once it is {@code submitted} or {@code approved}. */
@Entity
@Immutable
@Table(name = "timesheets")
public class Timesheet {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "engineer_id", nullable = false)
  private UUID engineerId;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "week_start", nullable = false)
  private LocalDate weekStart;

  protected Timesheet() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getEngineerId() {
    return engineerId;
  }

  public String getStatus() {
    return status;
  }

  public LocalDate getWeekStart() {
    return weekStart;
  }
}
