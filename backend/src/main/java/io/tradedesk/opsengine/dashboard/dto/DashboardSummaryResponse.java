package io.tradedesk.opsengine.dashboard.dto;

import java.util.List;

/** Headline figures for the office dashboard. */
public record DashboardSummaryResponse(
    boolean ok,
    SummaryCounts counts,
    QuoteSummary quotes,
    InvoiceSummary invoices,
    EnquirySummary enquiries,
    RevenueSummary revenue,
    List<TeamMember> engineers) {

  public static DashboardSummaryResponse of(
      SummaryCounts counts,
      QuoteSummary quotes,
      InvoiceSummary invoices,
      EnquirySummary enquiries,
      RevenueSummary revenue,
      List<TeamMember> engineers) {
    return new DashboardSummaryResponse(
        true, counts, quotes, invoices, enquiries, revenue, List.copyOf(engineers));
  }
}
