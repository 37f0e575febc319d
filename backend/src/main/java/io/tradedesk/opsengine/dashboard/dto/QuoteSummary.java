package io.tradedesk.opsengine.dashboard.dto;

import java.math.BigDecimal;

/** Quotes still awaiting a decision: drafts and sent quotes. */
public record QuoteSummary(
    long pendingCount, BigDecimal pendingValue, long draftCount, long sentCount) {}
