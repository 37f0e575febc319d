package io.tradedesk.opsengine.dashboard;

import io.tradedesk.opsengine.dashboard.dto.DailyRevenue;
import io.tradedesk.opsengine.dashboard.dto.InvoiceSummary;
import io.tradedesk.opsengine.dashboard.dto.MonthRevenue;
import io.tradedesk.opsengine.dashboard.dto.QuoteSummary;
import io.tradedesk.opsengine.dashboard.dto.RevenueSummary;
import io.tradedesk.opsengine.invoice.PaidInvoiceAmount;
import io.tradedesk.opsengine.invoice.UnpaidInvoiceTotals;
import io.tradedesk.opsengine.job.JobStatusCount;
import io.tradedesk.opsengine.quote.QuoteStatusTotal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Pure arithmetic behind the dashboard summary. Money is rounded half-up to pence. */
public final class DashboardSummarizer {

  static final DateTimeFormatter MONTH_NAME = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.UK);

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private DashboardSummarizer() {}

  public static Map<String, Long> jobCounts(List<JobStatusCount> rows) {
    var counts = new LinkedHashMap<String, Long>();
    for (JobStatusCount row : rows) {
      counts.merge(row.status(), row.count(), Long::sum);
    }
    return Collections.unmodifiableMap(counts);
  }

  public static Map<String, Long> quoteCounts(List<QuoteStatusTotal> rows) {
    var counts = new LinkedHashMap<String, Long>();
    for (QuoteStatusTotal row : rows) {
      counts.merge(row.status(), row.count(), Long::sum);
    }
    return Collections.unmodifiableMap(counts);
  }

  /** Drafts and sent quotes are pending; their totals make up the pending value. */
  public static QuoteSummary pendingQuotes(List<QuoteStatusTotal> rows) {
    long drafts = 0;
    long sent = 0;
    BigDecimal value = BigDecimal.ZERO;
    for (QuoteStatusTotal row : rows) {
      if ("draft".equals(row.status())) {
        drafts += row.count();
      } else if ("sent".equals(row.status())) {
        sent += row.count();
      } else {
        continue;
      }
      value = value.add(orZero(row.total()));
    }
    return new QuoteSummary(drafts + sent, money(value), drafts, sent);
  }

  /** @param totals null when the invoice source did not answer */
  public static InvoiceSummary invoices(UnpaidInvoiceTotals totals) {
    if (totals == null) {
      return new InvoiceSummary(0, 0, money(BigDecimal.ZERO));
    }
    return new InvoiceSummary(
        totals.unpaidCount(), totals.overdueCount(), money(orZero(totals.unpaidTotal())));
  }

  /**
   * Revenue for {@code month} against the month before it.
   *
   * @param payments paid invoices of {@code month}, used for the daily breakdown
   * @param thisMonthTotal exact total paid in {@code month}
   * @param lastMonthTotal exact total paid in the previous month
   */
  public static RevenueSummary revenue(
      YearMonth month,
      ZoneId zone,
      List<PaidInvoiceAmount> payments,
      BigDecimal thisMonthTotal,
      BigDecimal lastMonthTotal) {
    BigDecimal[] byDay = new BigDecimal[month.lengthOfMonth()];
    Arrays.fill(byDay, BigDecimal.ZERO);
    for (PaidInvoiceAmount payment : payments) {
      if (payment.paidAt() == null) {
        continue;
      }
      LocalDate day = LocalDate.ofInstant(payment.paidAt(), zone);
      if (YearMonth.from(day).equals(month)) {
        int index = day.getDayOfMonth() - 1;
        byDay[index] = byDay[index].add(orZero(payment.amount()));
      }
    }

    BigDecimal maxDaily = BigDecimal.ONE;
    for (BigDecimal amount : byDay) {
      maxDaily = maxDaily.max(amount);
    }
    var daily = new ArrayList<DailyRevenue>(byDay.length);
    for (int i = 0; i < byDay.length; i++) {
      int percentage =
          byDay[i].multiply(HUNDRED).divide(maxDaily, 0, RoundingMode.HALF_UP).intValue();
      daily.add(new DailyRevenue(month.atDay(i + 1), money(byDay[i]), percentage));
    }

    BigDecimal current = orZero(thisMonthTotal);
    BigDecimal previous = orZero(lastMonthTotal);
    return new RevenueSummary(
        new MonthRevenue(money(current), MONTH_NAME.format(month)),
        new MonthRevenue(money(previous), MONTH_NAME.format(month.minusMonths(1))),
        percentChange(current, previous),
        List.copyOf(daily),
        money(maxDaily));
  }

  static int percentChange(BigDecimal current, BigDecimal previous) {
    if (previous.signum() > 0) {
      return current
          .subtract(previous)
          .multiply(HUNDRED)
          .divide(previous, 0, RoundingMode.HALF_UP)
          .intValue();
    }
    return current.signum() > 0 ? 100 : 0;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }

  private static BigDecimal money(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }
}
