package io.tradedesk.opsengine.attention.detector;

import io.tradedesk.opsengine.attention.AttentionFinding;
import io.tradedesk.opsengine.attention.AttentionQuery;
import io.tradedesk.opsengine.attention.AttentionType;
import io.tradedesk.opsengine.attention.UrgencyPolicy;
import io.tradedesk.opsengine.display.AgeText;
import io.tradedesk.opsengine.display.DisplayName;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.invoice.InvoiceSource;
import io.tradedesk.opsengine.invoice.OverdueInvoiceRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Unpaid invoice whose due date has passed. Urgency grows with days overdue. */
@Component
public class InvoiceOverdueDetector implements AttentionDetector<OverdueInvoiceRecord> {

  private final InvoiceSource invoiceSource;
  private final UrgencyPolicy urgencyPolicy;

  public InvoiceOverdueDetector(InvoiceSource invoiceSource, UrgencyPolicy urgencyPolicy) {
    this.invoiceSource = invoiceSource;
    this.urgencyPolicy = urgencyPolicy;
  }

  @Override
  public AttentionType type() {
    return AttentionType.INVOICE_OVERDUE;
  }

  @Override
  public List<OverdueInvoiceRecord> fetch(AttentionQuery query) {
    return invoiceSource.overdue(query.tenantId(), query.now(), query.rowCap());
  }

  @Override
  public List<AttentionFinding> detect(List<OverdueInvoiceRecord> records, Instant now) {
    var findings = new ArrayList<AttentionFinding>();
    for (OverdueInvoiceRecord invoice : records) {
      if (invoice.dueAt() == null || !invoice.dueAt().isBefore(now)) {
        continue;
      }
      long days = AgeText.daysBetween(invoice.dueAt(), now);
      findings.add(
          new AttentionFinding(
              type(),
              invoice.id(),
              SafeText.format(
                  "Invoice #%s to %s is overdue",
                  DisplayRef.of(invoice.invoiceNumber(), invoice.id()),
                  DisplayName.of(invoice.clientName(), "a client")),
              AgeText.overdue(days),
              urgencyPolicy.score(type(), days, 0),
              invoice.dueAt()));
    }
    return findings;
  }
}
