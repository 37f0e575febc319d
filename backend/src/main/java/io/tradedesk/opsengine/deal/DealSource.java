package io.tradedesk.opsengine.deal;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DealSource {

  private final DealRepository dealRepository;

  public DealSource(DealRepository dealRepository) {
    this.dealRepository = dealRepository;
  }

  @Transactional(readOnly = true)
  public List<DealRecord> dealsForClient(String tenantId, UUID clientId, int rowCap) {
    return dealRepository.findRecordsForClient(tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<DealRecord> recentStageChanges(String tenantId, int rowCap) {
    return dealRepository.findRecentStageChanges(tenantId, PageRequest.of(0, rowCap));
  }
}
