package io.tradedesk.opsengine.quote;

import java.time.Instant;
import java.util.UUID;

/** Accepted quote that no live job was created from. */
public record AcceptedQuoteRecord(UUID id, String quoteNumber, Instant acceptedAt) {}
