package io.tradedesk.opsengine.certificate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Electrical certificate produced for a job. {@code certType} is the scheme code (EIC, EICR, MWC,
 * ...). A certificate is {@code completed} once tested and signed, {@code issued} once sent.
 */
@Entity
@Immutable
@Table(name = "certificates")
public class Certificate {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "certificate_number", length = 50)
  private String certificateNumber;

  @Column(name = "cert_type", nullable = false, length = 20)
  private String certType;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "issued_at")
  private Instant issuedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Certificate() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getJobId() {
    return jobId;
  }

  public String getCertificateNumber() {
    return certificateNumber;
  }

  public String getCertType() {
    return certType;
  }

  public String getStatus() {
    return status;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
