package io.tradedesk.opsengine.attention;

import io.tradedesk.opsengine.security.RoleNamespace;

/** Renders findings into dashboard items with links under the caller's namespace. */
public final class AttentionNormalizer {

  private AttentionNormalizer() {}

  public static AttentionItem toItem(AttentionFinding finding, RoleNamespace namespace) {
    AttentionType type = finding.type();
    return new AttentionItem(
        finding.id(),
        type,
        type.icon(),
        finding.message(),
        finding.age(),
        finding.urgency(),
        type.ctaLabel(),
        ctaHref(finding, namespace));
  }

  static String ctaHref(AttentionFinding finding, RoleNamespace namespace) {
    return switch (finding.type()) {
      case INVOICE_OVERDUE -> namespace.path("invoices", finding.entityId());
      case JOB_NO_INVOICE, OPEN_SNAGS -> namespace.path("jobs", finding.entityId());
      case MISSING_TIMESHEET -> namespace.path("timesheets");
      case CERT_NOT_ISSUED -> namespace.path("certificates", finding.entityId());
      case QUOTE_NO_JOB -> namespace.path("quotes", finding.entityId());
    };
  }
}
