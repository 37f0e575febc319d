package io.tradedesk.opsengine.multitenancy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Maps a Clerk organization to the tenant identifier that scopes every source query. */
@Entity
@Immutable
@Table(name = "org_tenant_mappings")
public class OrgTenantMapping {

  @Id private UUID id;

  @Column(name = "clerk_org_id", nullable = false, unique = true)
  private String clerkOrgId;

  @Column(name = "tenant_id", nullable = false, unique = true)
  private String tenantId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected OrgTenantMapping() {}

  public UUID getId() {
    return id;
  }

  public String getClerkOrgId() {
    return clerkOrgId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
