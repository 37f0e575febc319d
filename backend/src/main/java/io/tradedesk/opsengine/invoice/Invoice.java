package io.tradedesk.opsengine.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Customer invoice. Lifecycle owned by billing: {@code draft} → {@code sent} → ({@code part_paid}
 * | {@code overdue}) → {@code paid}, or {@code void}.
 *
 * <p>{@code token} is the public key used in client portal links.
 */
@Entity
@Immutable
@Table(name = "invoices")
public class Invoice {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "invoice_number", length = 50)
  private String invoiceNumber;

  @Column(name = "client_name")
  private String clientName;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "total", precision = 14, scale = 2, nullable = false)
  private BigDecimal total;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "token", length = 64)
  private String token;

  @Column(name = "issued_at")
  private Instant issuedAt;

  @Column(name = "due_at")
  private Instant dueAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Invoice() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getJobId() {
    return jobId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getClientName() {
    return clientName;
  }

  public String getStatus() {
    return status;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public String getCurrency() {
    return currency;
  }

  public String getToken() {
    return token;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getDueAt() {
    return dueAt;
  }

  public Instant getPaidAt() {
    return paidAt;
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
