package io.tradedesk.opsengine.invoice;

import java.math.BigDecimal;

/**
 * @param unpaidCount live invoices not yet paid, drafts included
 * @param overdueCount unpaid invoices already sent whose due date has passed
 * @param unpaidTotal sum of the unpaid invoices' totals
 */
public record UnpaidInvoiceTotals(long unpaidCount, long overdueCount, BigDecimal unpaidTotal) {}
