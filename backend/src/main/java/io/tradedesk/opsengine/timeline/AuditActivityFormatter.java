package io.tradedesk.opsengine.timeline;

import io.tradedesk.opsengine.audit.AuditEventRecord;
import io.tradedesk.opsengine.display.DisplayField;
import io.tradedesk.opsengine.display.DisplayName;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import org.springframework.stereotype.Component;

/** Maps audit events to human-readable activity titles. */
@Component
public class AuditActivityFormatter {

  public SafeText title(AuditEventRecord event) {
    Subject subject = subject(event);
    return SafeText.format(subject.template() + actionSuffix(event.action()), subject.field());
  }

  /** "by &lt;actor&gt;", or null when the event has no named actor. */
  public SafeText subtitle(AuditEventRecord event) {
    if (event.actorName() == null || event.actorName().isBlank()) {
      return null;
    }
    return SafeText.format("by %s", DisplayName.of(event.actorName(), "someone"));
  }

  /** Collection the audited entity lives under, or null for types without a page. */
  public String collection(String entityType) {
    if (entityType == null) {
      return null;
    }
    return switch (entityType) {
      case "invoice" -> "invoices";
      case "quote" -> "quotes";
      case "job" -> "jobs";
      case "certificate" -> "certificates";
      case "deal" -> "deals";
      case "enquiry" -> "enquiries";
      default -> null;
    };
  }

  private Subject subject(AuditEventRecord event) {
    String label = event.entityLabel();
    String type = event.entityType() != null ? event.entityType() : "";
    return switch (type) {
      case "invoice" -> new Subject("Invoice #%s", DisplayRef.of(label, event.entityId()));
      case "quote" -> new Subject("Quote #%s", DisplayRef.of(label, event.entityId()));
      case "certificate" -> new Subject("Certificate #%s", DisplayRef.of(label, event.entityId()));
      case "job" ->
          label != null && !label.isBlank()
              ? new Subject("%s", DisplayName.of(label, "Job"))
              : new Subject("Job %s", DisplayRef.of(null, event.entityId()));
      case "deal" -> new Subject("Deal %s", DisplayName.of(label, "untitled"));
      case "enquiry" -> new Subject("Enquiry from %s", DisplayName.of(label, "a visitor"));
      default -> new Subject("Record %s", DisplayRef.of(null, event.entityId()));
    };
  }

  private String actionSuffix(String action) {
    if (action == null) {
      return " updated";
    }
    return switch (action) {
      case "sent" -> " sent";
      case "accepted" -> " accepted";
      case "paid" -> " marked as paid";
      case "completed" -> " completed";
      case "scheduled" -> " scheduled";
      case "issued" -> " issued";
      case "created" -> " created";
      case "status_changed" -> " status changed";
      default -> " updated";
    };
  }

  private record Subject(String template, DisplayField field) {}
}
