package io.tradedesk.opsengine.certificate;

import java.time.Instant;
import java.util.UUID;

/** Timeline projection of a certificate with the title and site of its job. */
public record CertificateRecord(
    UUID id,
    String certificateNumber,
    String certType,
    String status,
    Instant issuedAt,
    Instant createdAt,
    String jobTitle,
    String siteName) {

  public Instant issuedOrCreatedAt() {
    return issuedAt != null ? issuedAt : createdAt;
  }
}
