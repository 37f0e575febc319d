package io.tradedesk.opsengine.quote;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Priced quote sent to a client. Accepted quotes are expected to turn into a job. */
@Entity
@Immutable
@Table(name = "quotes")
public class Quote {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "site_id")
  private UUID siteId;

  @Column(name = "quote_number", length = 50)
  private String quoteNumber;

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

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Quote() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getSiteId() {
    return siteId;
  }

  public String getQuoteNumber() {
    return quoteNumber;
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

  public Instant getAcceptedAt() {
    return acceptedAt;
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
