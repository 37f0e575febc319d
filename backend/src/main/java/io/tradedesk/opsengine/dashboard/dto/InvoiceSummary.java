package io.tradedesk.opsengine.dashboard.dto;

import java.math.BigDecimal;

public record InvoiceSummary(long unpaidCount, long overdueCount, BigDecimal unpaidTotal) {}
