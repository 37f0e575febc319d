package io.tradedesk.opsengine.timeline;

import io.tradedesk.opsengine.aggregation.FanOutResult;
import io.tradedesk.opsengine.aggregation.Rendered;
import io.tradedesk.opsengine.aggregation.SourceFanOut;
import io.tradedesk.opsengine.aggregation.SourceHandle;
import io.tradedesk.opsengine.aggregation.ViewKey;
import io.tradedesk.opsengine.aggregation.ViewRenderer;
import io.tradedesk.opsengine.audit.AuditSource;
import io.tradedesk.opsengine.certificate.CertificateSource;
import io.tradedesk.opsengine.client.ClientSource;
import io.tradedesk.opsengine.deal.DealSource;
import io.tradedesk.opsengine.enquiry.EnquirySource;
import io.tradedesk.opsengine.exception.ResourceNotFoundException;
import io.tradedesk.opsengine.exception.ServiceUnavailableException;
import io.tradedesk.opsengine.invoice.InvoiceSource;
import io.tradedesk.opsengine.job.JobSource;
import io.tradedesk.opsengine.quote.QuoteSource;
import io.tradedesk.opsengine.security.RoleNamespace;
import io.tradedesk.opsengine.timeline.dto.TimelineResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Timeline views: a short history of one job or client, the client portal feed and the dashboard
 * feed of recent activity. Each gathers its sources concurrently, normalizes every record into
 * facts, then keeps the newest up to the view's cap.
 */
@Service
public class TimelineService {

  private static final Logger log = LoggerFactory.getLogger(TimelineService.class);

  static final String ENTITY_VIEW = "timeline";
  static final String PORTAL_VIEW = "portal-timeline";
  static final String ACTIVITY_VIEW = "activity";

  private final JobSource jobSource;
  private final InvoiceSource invoiceSource;
  private final CertificateSource certificateSource;
  private final QuoteSource quoteSource;
  private final DealSource dealSource;
  private final EnquirySource enquirySource;
  private final AuditSource auditSource;
  private final ClientSource clientSource;
  private final TimelineNormalizer normalizer;
  private final SourceFanOut sourceFanOut;
  private final ViewRenderer viewRenderer;
  private final TimelineProperties properties;

  public TimelineService(
      JobSource jobSource,
      InvoiceSource invoiceSource,
      CertificateSource certificateSource,
      QuoteSource quoteSource,
      DealSource dealSource,
      EnquirySource enquirySource,
      AuditSource auditSource,
      ClientSource clientSource,
      TimelineNormalizer normalizer,
      SourceFanOut sourceFanOut,
      ViewRenderer viewRenderer,
      TimelineProperties properties) {
    this.jobSource = jobSource;
    this.invoiceSource = invoiceSource;
    this.certificateSource = certificateSource;
    this.quoteSource = quoteSource;
    this.dealSource = dealSource;
    this.enquirySource = enquirySource;
    this.auditSource = auditSource;
    this.clientSource = clientSource;
    this.normalizer = normalizer;
    this.sourceFanOut = sourceFanOut;
    this.viewRenderer = viewRenderer;
    this.properties = properties;
  }

  /**
   * Newest facts about one job or client.
   *
   * @throws ResourceNotFoundException if the entity does not exist in the tenant
   */
  public TimelineResponse getEntityTimeline(
      String tenantId, TimelineScope scope, UUID entityId, RoleNamespace namespace) {
    return viewRenderer.render(
        ViewKey.of(tenantId, ENTITY_VIEW, scope.key(), entityId, namespace),
        TimelineResponse.class,
        () ->
            switch (scope) {
              case JOB -> computeJobTimeline(tenantId, entityId, namespace);
              case CLIENT -> computeClientTimeline(tenantId, entityId, namespace);
            });
  }

  /** The portal customer's own feed: jobs, shared quotes, issued invoices and certificates. */
  public TimelineResponse getPortalTimeline(String tenantId, UUID customerId) {
    return viewRenderer.render(
        ViewKey.of(tenantId, PORTAL_VIEW, customerId),
        TimelineResponse.class,
        () -> computePortalTimeline(tenantId, customerId));
  }

  /** Latest audited changes merged with recently touched records across the tenant. */
  public TimelineResponse getRecentActivity(String tenantId, RoleNamespace namespace) {
    return viewRenderer.render(
        ViewKey.of(tenantId, ACTIVITY_VIEW, namespace),
        TimelineResponse.class,
        () -> computeRecentActivity(tenantId, namespace));
  }

  private Rendered<TimelineResponse> computeJobTimeline(
      String tenantId, UUID jobId, RoleNamespace namespace) {
    int rowCap = sourceFanOut.rowCap();

    var feed = new Feed(ENTITY_VIEW, tenantId, namespace);
    var job =
        feed.submit(
            "job", () -> jobSource.job(tenantId, jobId).stream().toList(), normalizer::fromJob);
    feed.submit(
        "invoices",
        () -> invoiceSource.invoicesForJob(tenantId, jobId, rowCap),
        normalizer::fromInvoice);
    feed.submit(
        "certificates",
        () -> certificateSource.certificatesForJob(tenantId, jobId, rowCap),
        normalizer::fromCertificate);
    return feed.collectFor(job, "Job", properties.entityCap());
  }

  private Rendered<TimelineResponse> computeClientTimeline(
      String tenantId, UUID clientId, RoleNamespace namespace) {
    int rowCap = sourceFanOut.rowCap();

    var feed = new Feed(ENTITY_VIEW, tenantId, namespace);
    var client =
        feed.fetch(
            "client",
            () -> clientSource.exists(tenantId, clientId) ? List.of(clientId) : List.<UUID>of());
    feed.submit(
        "jobs", () -> jobSource.jobsForClient(tenantId, clientId, rowCap), normalizer::fromJob);
    feed.submit(
        "invoices",
        () -> invoiceSource.invoicesForClient(tenantId, clientId, rowCap),
        normalizer::fromInvoice);
    feed.submit(
        "certificates",
        () -> certificateSource.certificatesForClient(tenantId, clientId, rowCap),
        normalizer::fromCertificate);
    feed.submit(
        "quotes",
        () -> quoteSource.quotesForClient(tenantId, clientId, rowCap),
        normalizer::fromQuote);
    feed.submit(
        "deals", () -> dealSource.dealsForClient(tenantId, clientId, rowCap), normalizer::fromDeal);
    return feed.collectFor(client, "Client", properties.entityCap());
  }

  private Rendered<TimelineResponse> computePortalTimeline(String tenantId, UUID customerId) {
    int rowCap = sourceFanOut.rowCap();

    var feed = new Feed(PORTAL_VIEW, tenantId, RoleNamespace.CLIENT);
    feed.submit(
        "jobs", () -> jobSource.jobsForClient(tenantId, customerId, rowCap), normalizer::fromJob);
    feed.submit(
        "invoices",
        () -> invoiceSource.issuedInvoicesForClient(tenantId, customerId, rowCap),
        normalizer::fromInvoice);
    feed.submit(
        "certificates",
        () -> certificateSource.issuedCertificatesForClient(tenantId, customerId, rowCap),
        normalizer::fromCertificate);
    feed.submit(
        "quotes",
        () -> quoteSource.quotesSharedWithClient(tenantId, customerId, rowCap),
        normalizer::fromQuote);
    return feed.collect(properties.portalCap());
  }

  private Rendered<TimelineResponse> computeRecentActivity(
      String tenantId, RoleNamespace namespace) {
    int perSource = properties.activityRowsPerSource();

    var feed = new Feed(ACTIVITY_VIEW, tenantId, namespace);
    feed.submit(
        "audit",
        () -> auditSource.recent(tenantId, properties.activityCap()),
        normalizer::fromAudit);
    feed.submit(
        "quotes", () -> quoteSource.recentlyUpdated(tenantId, perSource), normalizer::fromQuote);
    feed.submit(
        "invoices",
        () -> invoiceSource.recentlyUpdated(tenantId, perSource),
        normalizer::fromInvoice);
    feed.submit("jobs", () -> jobSource.recentlyUpdated(tenantId, perSource), normalizer::fromJob);
    feed.submit(
        "enquiries", () -> enquirySource.recent(tenantId, perSource), normalizer::fromEnquiry);
    feed.submit(
        "deals", () -> dealSource.recentStageChanges(tenantId, perSource), normalizer::fromDeal);
    return feed.collect(properties.activityCap());
  }

  /** Sources of one timeline computation and how each record becomes facts. */
  private final class Feed {

    private final String view;
    private final String tenantId;
    private final RoleNamespace namespace;
    private final SourceFanOut.FanOut fanOut;
    private final List<Function<FanOutResult, List<ActivityItem>>> pending = new ArrayList<>();

    Feed(String view, String tenantId, RoleNamespace namespace) {
      this.view = view;
      this.tenantId = tenantId;
      this.namespace = namespace;
      this.fanOut = sourceFanOut.begin(view, tenantId);
    }

    /** A source whose rows are only checked, never turned into facts. */
    <T> SourceHandle<T> fetch(String source, Supplier<List<T>> call) {
      return fanOut.submit(source, call);
    }

    <T> SourceHandle<T> submit(
        String source,
        Supplier<List<T>> call,
        BiFunction<T, RoleNamespace, List<ActivityItem>> toItems) {
      var handle = fanOut.submit(source, call);
      pending.add(
          result -> {
            var items = new ArrayList<ActivityItem>();
            for (T row : result.records(handle)) {
              items.addAll(toItems.apply(row, namespace));
            }
            return items;
          });
      return handle;
    }

    /** Collects a feed that is always served when at least one source answered. */
    Rendered<TimelineResponse> collect(int cap) {
      FanOutResult result = fanOut.awaitAll().requireAvailable();
      return build(result, cap);
    }

    /**
     * Collects the history of one entity. Its own lookup decides the outcome: unknown means 404,
     * unanswered means 503; the other sources may still fail and leave the feed partial.
     *
     * @throws ResourceNotFoundException if the entity lookup answered with no row
     * @throws ServiceUnavailableException if the entity lookup failed or timed out
     */
    Rendered<TimelineResponse> collectFor(SourceHandle<?> entity, String entityName, int cap) {
      FanOutResult result = fanOut.awaitAll();
      if (result.failed(entity)) {
        throw new ServiceUnavailableException(
            "Service unavailable", "Data is temporarily unavailable");
      }
      if (result.records(entity).isEmpty()) {
        throw new ResourceNotFoundException(entityName);
      }
      return build(result, cap);
    }

    private Rendered<TimelineResponse> build(FanOutResult result, int cap) {
      var items = new ArrayList<ActivityItem>();
      for (var normalize : pending) {
        items.addAll(normalize.apply(result));
      }
      List<ActivityItem> capped = TimelineRanker.newestFirst(items, cap);
      log.debug(
          "Timeline built: view={}, tenant={}, facts={}, returned={}, partial={}",
          view,
          tenantId,
          items.size(),
          capped.size(),
          result.isPartial());
      return Rendered.of(TimelineResponse.of(capped), result);
    }
  }
}
