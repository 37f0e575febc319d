package io.tradedesk.opsengine.client;

import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClientSource {

  private final ClientRepository clientRepository;

  public ClientSource(ClientRepository clientRepository) {
    this.clientRepository = clientRepository;
  }

  @Transactional(readOnly = true)
  public boolean exists(String tenantId, UUID clientId) {
    return clientRepository.existsByIdAndTenantIdAndDeletedAtIsNull(clientId, tenantId);
  }
}
