package io.tradedesk.opsengine.enquiry;

import java.time.Instant;
import java.util.UUID;

public record EnquiryRecord(UUID id, String name, String source, String status, Instant createdAt) {}
