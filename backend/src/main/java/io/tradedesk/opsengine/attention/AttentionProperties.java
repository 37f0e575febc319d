package io.tradedesk.opsengine.attention;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Attention view policy.
 *
 * @param cap maximum items returned by the attention view
 * @param jobNoInvoiceAfter how long a completed job may wait for an invoice
 * @param certNotIssuedAfter how long a completed certificate may wait to be issued
 * @param quoteNoJobAfter how long an accepted quote may wait for a job
 * @param timesheetLookback window of time entries checked for missing timesheets
 * @param urgency per-type overrides of the default urgency rules
 */
@ConfigurationProperties(prefix = "ops.attention")
public record AttentionProperties(
    int cap,
    Duration jobNoInvoiceAfter,
    Duration certNotIssuedAfter,
    Duration quoteNoJobAfter,
    Duration timesheetLookback,
    Map<AttentionType, UrgencyRule> urgency) {

  public AttentionProperties {
    cap = cap > 0 ? cap : 6;
    jobNoInvoiceAfter = jobNoInvoiceAfter != null ? jobNoInvoiceAfter : Duration.ofDays(3);
    certNotIssuedAfter = certNotIssuedAfter != null ? certNotIssuedAfter : Duration.ofDays(2);
    quoteNoJobAfter = quoteNoJobAfter != null ? quoteNoJobAfter : Duration.ofDays(2);
    timesheetLookback = timesheetLookback != null ? timesheetLookback : Duration.ofDays(7);
    var rules = defaultRules();
    if (urgency != null) {
      rules.putAll(urgency);
    }
    urgency = Map.copyOf(rules);
  }

  public static AttentionProperties defaults() {
    return new AttentionProperties(0, null, null, null, null, null);
  }

  private static EnumMap<AttentionType, UrgencyRule> defaultRules() {
    var rules = new EnumMap<AttentionType, UrgencyRule>(AttentionType.class);
    rules.put(AttentionType.INVOICE_OVERDUE, new UrgencyRule(300, 10, 0, 1000));
    rules.put(AttentionType.JOB_NO_INVOICE, new UrgencyRule(200, 5, 0, 700));
    rules.put(AttentionType.MISSING_TIMESHEET, UrgencyRule.flat(50));
    rules.put(AttentionType.CERT_NOT_ISSUED, new UrgencyRule(150, 5, 0, 600));
    rules.put(AttentionType.OPEN_SNAGS, new UrgencyRule(100, 1, 25, 600));
    rules.put(AttentionType.QUOTE_NO_JOB, new UrgencyRule(150, 5, 0, 600));
    return rules;
  }
}
