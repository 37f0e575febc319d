package io.tradedesk.opsengine.quote;

import java.util.UUID;

public record QuotePinRecord(
    UUID id,
    String quoteNumber,
    String clientName,
    String status,
    Double latitude,
    Double longitude) {}
