package io.tradedesk.opsengine.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends Repository<AuditEvent, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.audit.AuditEventRecord(
          a.id, a.entityType, a.entityId, a.action, a.actorName, a.entityLabel, a.occurredAt)
      FROM AuditEvent a
      WHERE a.tenantId = :tenantId
      ORDER BY a.occurredAt DESC, a.id ASC
      """)
  List<AuditEventRecord> findRecent(@Param("tenantId") String tenantId, Pageable pageable);
}
