package io.tradedesk.opsengine.dashboard.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/** @param percentage the day's share of the month's best day, 0 to 100 */
public record DailyRevenue(LocalDate date, BigDecimal amount, int percentage) {}
