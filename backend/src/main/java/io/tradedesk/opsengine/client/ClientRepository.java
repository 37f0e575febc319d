package io.tradedesk.opsengine.client;

import java.util.UUID;
import org.springframework.data.repository.Repository;

public interface ClientRepository extends Repository<Client, UUID> {

  boolean existsByIdAndTenantIdAndDeletedAtIsNull(UUID id, String tenantId);
}
