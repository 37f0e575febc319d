package io.tradedesk.opsengine.enquiry;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface EnquiryRepository extends Repository<Enquiry, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.enquiry.EnquiryRecord(
          e.id, e.name, e.source, e.status, e.createdAt)
      FROM Enquiry e
      WHERE e.tenantId = :tenantId AND e.deletedAt IS NULL
      ORDER BY e.createdAt DESC, e.id ASC
      """)
  List<EnquiryRecord> findRecent(@Param("tenantId") String tenantId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(e) FROM Enquiry e
      WHERE e.tenantId = :tenantId
        AND e.deletedAt IS NULL
        AND e.status NOT IN ('won', 'lost')
      """)
  long countOpen(@Param("tenantId") String tenantId);
}
