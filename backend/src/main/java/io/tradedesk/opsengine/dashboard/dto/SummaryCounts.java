package io.tradedesk.opsengine.dashboard.dto;

import java.util.Map;

/**
 * @param jobs live jobs per status
 * @param quotes live quotes per status
 * @param timesheetsPendingApproval submitted timesheets not yet approved
 */
public record SummaryCounts(
    Map<String, Long> jobs, Map<String, Long> quotes, long timesheetsPendingApproval) {}
