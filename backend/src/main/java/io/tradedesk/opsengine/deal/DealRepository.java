package io.tradedesk.opsengine.deal;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface DealRepository extends Repository<Deal, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.deal.DealRecord(
          d.id, d.title, d.stage, d.value, d.currency, d.stageChangedAt, d.createdAt)
      FROM Deal d
      WHERE d.tenantId = :tenantId AND d.clientId = :clientId AND d.deletedAt IS NULL
      ORDER BY COALESCE(d.stageChangedAt, d.createdAt) DESC, d.id ASC
      """)
  List<DealRecord> findRecordsForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.deal.DealRecord(
          d.id, d.title, d.stage, d.value, d.currency, d.stageChangedAt, d.createdAt)
      FROM Deal d
      WHERE d.tenantId = :tenantId AND d.deletedAt IS NULL
      ORDER BY COALESCE(d.stageChangedAt, d.createdAt) DESC, d.id ASC
      """)
  List<DealRecord> findRecentStageChanges(@Param("tenantId") String tenantId, Pageable pageable);
}
