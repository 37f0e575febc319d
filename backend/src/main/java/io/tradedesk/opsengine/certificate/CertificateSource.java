package io.tradedesk.opsengine.certificate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CertificateSource {

  private final CertificateRepository certificateRepository;

  public CertificateSource(CertificateRepository certificateRepository) {
    this.certificateRepository = certificateRepository;
  }

  @Transactional(readOnly = true)
  public List<UnissuedCertificateRecord> completedNotIssued(
      String tenantId, Instant completedBy, int rowCap) {
    return certificateRepository.findCompletedNotIssued(
        tenantId, completedBy, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<CertificateRecord> certificatesForJob(String tenantId, UUID jobId, int rowCap) {
    return certificateRepository.findRecordsForJob(tenantId, jobId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<CertificateRecord> certificatesForClient(
      String tenantId, UUID clientId, int rowCap) {
    return certificateRepository.findRecordsForClient(
        tenantId, clientId, PageRequest.of(0, rowCap));
  }

  @Transactional(readOnly = true)
  public List<CertificateRecord> issuedCertificatesForClient(
      String tenantId, UUID clientId, int rowCap) {
    return certificateRepository.findIssuedForClient(
        tenantId, clientId, PageRequest.of(0, rowCap));
  }
}
