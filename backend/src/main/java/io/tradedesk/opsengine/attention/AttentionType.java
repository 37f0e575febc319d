package io.tradedesk.opsengine.attention;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed catalogue of attention conditions. Each constant has exactly one detector; switches over
 * this enum are written without a default branch so a new constant fails compilation until every
 * switch handles it.
 */
public enum AttentionType {
  INVOICE_OVERDUE("invoice_overdue", AttentionIcon.CLOCK, "Chase payment"),
  JOB_NO_INVOICE("job_no_invoice", AttentionIcon.FILE_TEXT, "Create invoice"),
  MISSING_TIMESHEET("missing_timesheet", AttentionIcon.CLOCK, "Review timesheets"),
  CERT_NOT_ISSUED("cert_not_issued", AttentionIcon.SHIELD, "Issue certificate"),
  OPEN_SNAGS("open_snags", AttentionIcon.ALERT_CIRCLE, "Review snags"),
  QUOTE_NO_JOB("quote_no_job", AttentionIcon.BRIEFCASE, "Create job");

  private final String key;
  private final AttentionIcon icon;
  private final String ctaLabel;

  AttentionType(String key, AttentionIcon icon, String ctaLabel) {
    this.key = key;
    this.icon = icon;
    this.ctaLabel = ctaLabel;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public AttentionIcon icon() {
    return icon;
  }

  public String ctaLabel() {
    return ctaLabel;
  }
}
