package io.tradedesk.opsengine.multitenancy;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.repository.Repository;

public interface OrgTenantMappingRepository extends Repository<OrgTenantMapping, UUID> {

  Optional<OrgTenantMapping> findByClerkOrgId(String clerkOrgId);
}
