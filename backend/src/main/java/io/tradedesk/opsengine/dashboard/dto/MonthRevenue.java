package io.tradedesk.opsengine.dashboard.dto;

import java.math.BigDecimal;

/** @param monthName display name such as {@code March 2026} */
public record MonthRevenue(BigDecimal total, String monthName) {}
