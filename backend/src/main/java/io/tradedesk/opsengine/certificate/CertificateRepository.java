package io.tradedesk.opsengine.certificate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface CertificateRepository extends Repository<Certificate, UUID> {

  @Query(
      """
      SELECT new io.tradedesk.opsengine.certificate.UnissuedCertificateRecord(
          c.id, c.certificateNumber, c.completedAt)
      FROM Certificate c
      WHERE c.tenantId = :tenantId
        AND c.deletedAt IS NULL
        AND c.status = 'completed'
        AND c.issuedAt IS NULL
        AND c.completedAt IS NOT NULL
        AND c.completedAt <= :completedBy
      ORDER BY c.completedAt ASC, c.id ASC
      """)
  List<UnissuedCertificateRecord> findCompletedNotIssued(
      @Param("tenantId") String tenantId,
      @Param("completedBy") Instant completedBy,
      Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.certificate.CertificateRecord(
          c.id, c.certificateNumber, c.certType, c.status, c.issuedAt, c.createdAt,
          j.title, s.name)
      FROM Certificate c
        JOIN Job j ON j.id = c.jobId AND j.tenantId = :tenantId
        LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE c.tenantId = :tenantId AND c.jobId = :jobId AND c.deletedAt IS NULL
      ORDER BY c.createdAt DESC, c.id ASC
      """)
  List<CertificateRecord> findRecordsForJob(
      @Param("tenantId") String tenantId, @Param("jobId") UUID jobId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.certificate.CertificateRecord(
          c.id, c.certificateNumber, c.certType, c.status, c.issuedAt, c.createdAt,
          j.title, s.name)
      FROM Certificate c
        JOIN Job j ON j.id = c.jobId AND j.tenantId = :tenantId
        LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE c.tenantId = :tenantId
        AND j.clientId = :clientId
        AND c.deletedAt IS NULL
        AND j.deletedAt IS NULL
      ORDER BY c.createdAt DESC, c.id ASC
      """)
  List<CertificateRecord> findRecordsForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);

  @Query(
      """
      SELECT new io.tradedesk.opsengine.certificate.CertificateRecord(
          c.id, c.certificateNumber, c.certType, c.status, c.issuedAt, c.createdAt,
          j.title, s.name)
      FROM Certificate c
        JOIN Job j ON j.id = c.jobId AND j.tenantId = :tenantId
        LEFT JOIN Site s ON s.id = j.siteId AND s.tenantId = :tenantId
      WHERE c.tenantId = :tenantId
        AND j.clientId = :clientId
        AND c.status = 'issued'
        AND c.deletedAt IS NULL
        AND j.deletedAt IS NULL
      ORDER BY c.createdAt DESC, c.id ASC
      """)
  List<CertificateRecord> findIssuedForClient(
      @Param("tenantId") String tenantId, @Param("clientId") UUID clientId, Pageable pageable);
}
