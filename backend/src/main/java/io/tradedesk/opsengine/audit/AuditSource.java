package io.tradedesk.opsengine.audit;

import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditSource {

  private final AuditEventRepository auditEventRepository;

  public AuditSource(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Transactional(readOnly = true)
  public List<AuditEventRecord> recent(String tenantId, int rowCap) {
    return auditEventRepository.findRecent(tenantId, PageRequest.of(0, rowCap));
  }
}
