package io.tradedesk.opsengine.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Append-only audit event written by the business modules when an entity changes state. {@code
 * entityLabel} is the human label of the entity at that moment (invoice number, job title).
 */
@Entity
@Immutable
@Table(name = "audit_events")
public class AuditEvent {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "action", nullable = false, length = 50)
  private String action;

  @Column(name = "actor_name")
  private String actorName;

  @Column(name = "entity_label")
  private String entityLabel;

  @Column(name = "occurred_at", nullable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public String getAction() {
    return action;
  }

  public String getActorName() {
    return actorName;
  }

  public String getEntityLabel() {
    return entityLabel;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
