package io.tradedesk.opsengine.timeline;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of fact a timeline item can describe. */
public enum ActivityKind {
  JOB("job"),
  JOB_COMPLETED("job_completed"),
  INVOICE("invoice"),
  INVOICE_PAID("invoice_paid"),
  CERTIFICATE("certificate"),
  QUOTE("quote"),
  QUOTE_ACCEPTED("quote_accepted"),
  DEAL_STAGE_CHANGE("deal_stage_change"),
  ENQUIRY("enquiry"),
  AUDIT("audit");

  private final String key;

  ActivityKind(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }
}
