package io.tradedesk.opsengine.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Field job. Status values are owned by the job workflow: {@code scheduled}, {@code in_progress},
 * {@code completed}, {@code closed}, {@code cancelled}.
 *
 * <p>{@code quoteId} links a job to the accepted quote it was created from, {@code
 * assignedEngineerId} to the engineer doing the work.
 */
@Entity
@Immutable
@Table(name = "jobs")
public class Job {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "quote_id")
  private UUID quoteId;

  @Column(name = "site_id")
  private UUID siteId;

  @Column(name = "assigned_engineer_id")
  private UUID assignedEngineerId;

  @Column(name = "job_number", length = 50)
  private String jobNumber;

  @Column(name = "title")
  private String title;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "scheduled_start")
  private Instant scheduledStart;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Job() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getQuoteId() {
    return quoteId;
  }

  public UUID getSiteId() {
    return siteId;
  }

  public UUID getAssignedEngineerId() {
    return assignedEngineerId;
  }

  public String getJobNumber() {
    return jobNumber;
  }

  public String getTitle() {
    return title;
  }

  public String getStatus() {
    return status;
  }

  public Instant getScheduledStart() {
    return scheduledStart;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
