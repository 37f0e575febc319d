package io.tradedesk.opsengine.dashboard.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Revenue from invoices paid this month against last month.
 *
 * @param percentChange whole-percent change on last month; 100 when last month had none
 * @param dailyRevenue one entry per day of the current month
 */
public record RevenueSummary(
    MonthRevenue thisMonth,
    MonthRevenue lastMonth,
    int percentChange,
    List<DailyRevenue> dailyRevenue,
    BigDecimal maxDailyRevenue) {}
