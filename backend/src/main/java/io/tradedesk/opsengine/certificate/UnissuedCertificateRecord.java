package io.tradedesk.opsengine.certificate;

import java.time.Instant;
import java.util.UUID;

public record UnissuedCertificateRecord(UUID id, String certificateNumber, Instant completedAt) {}
