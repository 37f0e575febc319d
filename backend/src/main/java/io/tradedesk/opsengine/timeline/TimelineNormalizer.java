package io.tradedesk.opsengine.timeline;

import io.tradedesk.opsengine.audit.AuditEventRecord;
import io.tradedesk.opsengine.certificate.CertificateRecord;
import io.tradedesk.opsengine.deal.DealRecord;
import io.tradedesk.opsengine.display.DisplayName;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.enquiry.EnquiryRecord;
import io.tradedesk.opsengine.invoice.InvoiceRecord;
import io.tradedesk.opsengine.job.JobRecord;
import io.tradedesk.opsengine.job.JobStatuses;
import io.tradedesk.opsengine.quote.QuoteRecord;
import io.tradedesk.opsengine.security.RoleNamespace;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Turns source records into timeline facts. One record may yield two facts (created and
 * completed, issued and paid); each carries its own timestamp and prefixed id.
 */
@Component
public class TimelineNormalizer {

  static final Map<String, String> CERTIFICATE_LABELS =
      Map.of(
          "EIC", "Electrical Installation Certificate",
          "EICR", "Electrical Condition Report",
          "MWC", "Minor Works Certificate",
          "BS7671", "BS 7671 Certificate");

  private final AuditActivityFormatter auditFormatter;

  public TimelineNormalizer(AuditActivityFormatter auditFormatter) {
    this.auditFormatter = auditFormatter;
  }

  public List<ActivityItem> fromJob(JobRecord job, RoleNamespace namespace) {
    SafeText jobTitle = jobTitle(job);
    SafeText location = location(job);
    String link = namespace.path("jobs", job.id());

    var items = new ArrayList<ActivityItem>(2);
    items.add(
        new ActivityItem(
            "job-" + job.id(),
            job.createdAt(),
            ActivityKind.JOB,
            jobTitle,
            location,
            job.status(),
            null,
            null,
            link,
            null));
    if (JobStatuses.isFinished(job.status())) {
      SafeText subtitle =
          job.siteName() != null && !job.siteName().isBlank()
              ? SafeText.format(
                  "%s - %s",
                  DisplayName.of(jobTitle.value(), "Job"),
                  DisplayName.of(job.siteName(), ""))
              : jobTitle;
      items.add(
          new ActivityItem(
              "job-done-" + job.id(),
              job.finishedAt(),
              ActivityKind.JOB_COMPLETED,
              SafeText.constant("Work completed"),
              subtitle,
              JobStatuses.COMPLETED,
              null,
              null,
              link,
              null));
    }
    return items;
  }

  public List<ActivityItem> fromInvoice(InvoiceRecord invoice, RoleNamespace namespace) {
    SafeText invoiceTitle =
        SafeText.format("Invoice %s", DisplayRef.of(invoice.invoiceNumber(), invoice.id()));
    String key = publicKey(namespace, invoice.token(), invoice.id());
    String link = namespace.path("invoices", key);

    var items = new ArrayList<ActivityItem>(2);
    items.add(
        new ActivityItem(
            "inv-" + invoice.id(),
            invoice.issuedOrCreatedAt(),
            ActivityKind.INVOICE,
            invoiceTitle,
            clientName(invoice.clientName(), namespace),
            invoice.status(),
            invoice.total(),
            invoice.currency(),
            link,
            namespace.path("invoices", key, "pdf")));
    if (invoice.isPaid()) {
      items.add(
          new ActivityItem(
              "inv-paid-" + invoice.id(),
              invoice.paidAt(),
              ActivityKind.INVOICE_PAID,
              SafeText.constant("Payment received"),
              invoiceTitle,
              InvoiceRecord.STATUS_PAID,
              invoice.total(),
              invoice.currency(),
              link,
              null));
    }
    return items;
  }

  public List<ActivityItem> fromCertificate(CertificateRecord cert, RoleNamespace namespace) {
    SafeText subtitle = null;
    if (cert.siteName() != null && !cert.siteName().isBlank()) {
      subtitle = SafeText.format("%s", DisplayName.of(cert.siteName(), ""));
    } else if (cert.jobTitle() != null && !cert.jobTitle().isBlank()) {
      subtitle = SafeText.format("%s", DisplayName.of(cert.jobTitle(), ""));
    }
    String key = cert.id().toString();
    return List.of(
        new ActivityItem(
            "cert-" + cert.id(),
            cert.issuedOrCreatedAt(),
            ActivityKind.CERTIFICATE,
            certificateLabel(cert.certType()),
            subtitle,
            cert.status(),
            null,
            null,
            namespace.path("certificates", key),
            cert.issuedAt() != null ? namespace.path("certificates", key, "pdf") : null));
  }

  public List<ActivityItem> fromQuote(QuoteRecord quote, RoleNamespace namespace) {
    SafeText quoteTitle =
        SafeText.format("Quote %s", DisplayRef.of(quote.quoteNumber(), quote.id()));
    String link = namespace.path("quotes", publicKey(namespace, quote.token(), quote.id()));

    var items = new ArrayList<ActivityItem>(2);
    items.add(
        new ActivityItem(
            "quote-" + quote.id(),
            quote.createdAt(),
            ActivityKind.QUOTE,
            quoteTitle,
            clientName(quote.clientName(), namespace),
            quote.status(),
            quote.total(),
            quote.currency(),
            link,
            null));
    if (quote.isAccepted()) {
      items.add(
          new ActivityItem(
              "quote-accepted-" + quote.id(),
              quote.acceptedAt(),
              ActivityKind.QUOTE_ACCEPTED,
              SafeText.constant("Quote accepted"),
              quoteTitle,
              QuoteRecord.STATUS_ACCEPTED,
              quote.total(),
              quote.currency(),
              link,
              null));
    }
    return items;
  }

  public List<ActivityItem> fromDeal(DealRecord deal, RoleNamespace namespace) {
    return List.of(
        new ActivityItem(
            "deal-" + deal.id(),
            deal.changedAt(),
            ActivityKind.DEAL_STAGE_CHANGE,
            SafeText.format("Deal moved to %s", DisplayName.of(deal.stage(), "a new stage")),
            SafeText.format("%s", DisplayName.of(deal.title(), "Untitled deal")),
            deal.stage(),
            deal.value(),
            deal.value() != null ? deal.currency() : null,
            namespace.path("deals", deal.id()),
            null));
  }

  public List<ActivityItem> fromEnquiry(EnquiryRecord enquiry, RoleNamespace namespace) {
    SafeText subtitle =
        enquiry.source() != null && !enquiry.source().isBlank()
            ? SafeText.format("via %s", DisplayName.of(enquiry.source(), ""))
            : null;
    return List.of(
        new ActivityItem(
            "enquiry-" + enquiry.id(),
            enquiry.createdAt(),
            ActivityKind.ENQUIRY,
            SafeText.format("New enquiry from %s", DisplayName.of(enquiry.name(), "a visitor")),
            subtitle,
            enquiry.status(),
            null,
            null,
            namespace.path("enquiries", enquiry.id()),
            null));
  }

  public List<ActivityItem> fromAudit(AuditEventRecord event, RoleNamespace namespace) {
    String collection = auditFormatter.collection(event.entityType());
    return List.of(
        new ActivityItem(
            "audit-" + event.id(),
            event.occurredAt(),
            ActivityKind.AUDIT,
            auditFormatter.title(event),
            auditFormatter.subtitle(event),
            event.action(),
            null,
            null,
            collection != null ? namespace.path(collection, event.entityId()) : null,
            null));
  }

  static SafeText certificateLabel(String certType) {
    String label = certType != null ? CERTIFICATE_LABELS.get(certType) : null;
    if (label != null) {
      return SafeText.constant(label);
    }
    return SafeText.format("%s Certificate", DisplayName.of(certType, "Electrical"));
  }

  private static SafeText jobTitle(JobRecord job) {
    if (job.title() != null && !job.title().isBlank()) {
      return SafeText.format("%s", DisplayName.of(job.title(), "Job"));
    }
    return SafeText.format("Job #%s", DisplayRef.of(job.jobNumber(), job.id()));
  }

  private static SafeText location(JobRecord job) {
    String joined =
        Stream.of(job.siteName(), job.siteAddress(), job.siteCity())
            .filter(part -> part != null && !part.isBlank())
            .collect(Collectors.joining(", "));
    return joined.isEmpty() ? null : SafeText.format("%s", DisplayName.of(joined, ""));
  }

  /** Operators see the client's name; the client already knows who they are. */
  private static SafeText clientName(String clientName, RoleNamespace namespace) {
    if (namespace == RoleNamespace.CLIENT || clientName == null || clientName.isBlank()) {
      return null;
    }
    return SafeText.format("%s", DisplayName.of(clientName, ""));
  }

  /** Portal links use the public token when the record has one. */
  private static String publicKey(RoleNamespace namespace, String token, UUID id) {
    if (namespace == RoleNamespace.CLIENT && token != null && !token.isBlank()) {
      return token;
    }
    return id.toString();
  }
}
