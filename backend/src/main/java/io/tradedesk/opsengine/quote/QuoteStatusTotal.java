package io.tradedesk.opsengine.quote;

import java.math.BigDecimal;

/** Live quotes in one status with the sum of their totals. */
public record QuoteStatusTotal(String status, long count, BigDecimal total) {}
