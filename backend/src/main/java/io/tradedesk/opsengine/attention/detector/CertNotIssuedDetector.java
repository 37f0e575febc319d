package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionProperties;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.certificate.CertificateSource;
import io.tradedesk.opsengine.certificate.UnissuedCertificateRecord;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class CertNotIssuedDetector implements AttentionDetector<UnissuedCertificateRecord> {

  private final CertificateSource certificateSource;
  private final UrgencyPolicy urgencyPolicy;
  private final AttentionProperties properties;

  public CertNotIssuedDetector(
      CertificateSource certificateSource,
      UrgencyPolicy urgencyPolicy,
      AttentionProperties properties) {
    this.certificateSource = certificateSource;
    this.urgencyPolicy = urgencyPolicy;
    this.properties = properties;
  }

  @Override
  public AttentionType type() {
    return AttentionType.CERT_NOT_ISSUED;
  }

  @Override
  public List<UnissuedCertificateRecord> fetch(AttentionQuery query) {
    return certificateSource.completedNotIssued(
        query.tenantId(), query.now().minus(properties.certNotIssuedAfter()), query.rowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<UnissuedCertificateRecord> records, Instant now) {
    Instant cutoff = now.minus(properties.certNotIssuedAfter());
    var findings = new ArrayList<AttentionFinding>();
    for (UnissuedCertificateRecord cert : records) {
      if (cert.completedAt() == null || cert.completedAt().isAfter(cutoff)) {
        continue;
      }
      long days = AgeText.daysBetween(cert.completedAt(), now);
      findings.add(
          new AttentionFinding(
              type(),
              cert.id(),
              SafeText.format(
                  "Certificate #%s completed, not yet issued",
                  DisplayRef.of(cert.certificateNumber(), cert.id())),
              AgeText.ago(days),
              urgencyPolicy.score(type(), days, 0),
              cert.completedAt()));
    }
    return findings;
  }
}
