package io.tradedesk.opsengine.deal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Sales pipeline deal. {@code stageChangedAt} records the last move between pipeline stages. */
@Entity
@Immutable
@Table(name = "deals")
public class Deal {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "title")
  private String title;

  @Column(name = "stage", nullable = false, length = 30)
  private String stage;

  @Column(name = "deal_value", precision = 14, scale = 2)
  private BigDecimal value;

  @Column(name = "currency", length = 3)
  private String currency;

  @Column(name = "stage_changed_at")
  private Instant stageChangedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Deal() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getClientId() {
    return clientId;
  }

  public String getTitle() {
    return title;
  }

  public String getStage() {
    return stage;
  }

  public BigDecimal getValue() {
    return value;
  }

  public String getCurrency() {
    return currency;
  }

  public Instant getStageChangedAt() {
    return stageChangedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
