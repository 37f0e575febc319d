package io.tradedesk.opsengine.dashboard;

import io.tradedesk.opsengine.aggregation.FanOutResult;
import io.tradedesk.opsengine.aggregation.Rendered;
import io.tradedesk.opsengine.aggregation.SourceFanOut;
import io.tradedesk.opsengine.aggregation.ViewKey;
import io.tradedesk.opsengine.aggregation.ViewRenderer;
import io.tradedesk.opsengine.dashboard.dto.DashboardSummaryResponse;
import io.tradedesk.opsengine.dashboard.dto.EngineerActivity;
import io.tradedesk.opsengine.dashboard.dto.EngineerActivityResponse;
import io.tradedesk.opsengine.dashboard.dto.EnquirySummary;
import io.tradedesk.opsengine.dashboard.dto.HealthFlagsResponse;
import io.tradedesk.opsengine.dashboard.dto.MapPin;
import io.tradedesk.opsengine.dashboard.dto.MapPinType;
import io.tradedesk.opsengine.dashboard.dto.MapPinsResponse;
import io.tradedesk.opsengine.dashboard.dto.SummaryCounts;
import io.tradedesk.opsengine.dashboard.dto.TeamMember;
import io.tradedesk.opsengine.display.DisplayName;
import io.tradedesk.opsengine.display.DisplayRef;
import io.tradedesk.opsengine.display.SafeText;
import io.tradedesk.opsengine.enquiry.EnquirySource;
import io.tradedesk.opsengine.invoice.InvoiceSource;
import io.tradedesk.opsengine.invoice.UnpaidInvoiceTotals;
import io.tradedesk.opsengine.job.JobPinRecord;
import io.tradedesk.opsengine.job.JobSource;
import io.tradedesk.opsengine.job.ScheduledJobCount;
import io.tradedesk.opsengine.quote.QuotePinRecord;
import io.tradedesk.opsengine.quote.QuoteSource;
import io.tradedesk.opsengine.security.RoleNamespace;
import io.tradedesk.opsengine.timesheet.EngineerLastActive;
import io.tradedesk.opsengine.timesheet.EngineerRecord;
import io.tradedesk.opsengine.timesheet.TimesheetSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Operations dashboard views built from the source fan-out. */
@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  static final String HEALTH_FLAGS_VIEW = "health-flags";
  static final String ENGINEER_ACTIVITY_VIEW = "engineer-activity";
  static final String MAP_PINS_VIEW = "map-pins";
  static final String SUMMARY_VIEW = "summary";

  private final JobSource jobSource;
  private final InvoiceSource invoiceSource;
  private final QuoteSource quoteSource;
  private final TimesheetSource timesheetSource;
  private final EnquirySource enquirySource;
  private final SourceFanOut sourceFanOut;
  private final ViewRenderer viewRenderer;
  private final DashboardProperties properties;
  private final Clock clock;

  public DashboardService(
      JobSource jobSource,
      InvoiceSource invoiceSource,
      QuoteSource quoteSource,
      TimesheetSource timesheetSource,
      EnquirySource enquirySource,
      SourceFanOut sourceFanOut,
      ViewRenderer viewRenderer,
      DashboardProperties properties,
      Clock clock) {
    this.jobSource = jobSource;
    this.invoiceSource = invoiceSource;
    this.quoteSource = quoteSource;
    this.timesheetSource = timesheetSource;
    this.enquirySource = enquirySource;
    this.sourceFanOut = sourceFanOut;
    this.viewRenderer = viewRenderer;
    this.properties = properties;
    this.clock = clock;
  }

  public DashboardSummaryResponse getSummary(String tenantId) {
    return viewRenderer.render(
        ViewKey.of(tenantId, SUMMARY_VIEW),
        DashboardSummaryResponse.class,
        () -> computeSummary(tenantId));
  }

  public HealthFlagsResponse getHealthFlags(String tenantId) {
    return viewRenderer.render(
        ViewKey.of(tenantId, HEALTH_FLAGS_VIEW),
        HealthFlagsResponse.class,
        () -> computeHealthFlags(tenantId));
  }

  public EngineerActivityResponse getEngineerActivity(String tenantId) {
    return viewRenderer.render(
        ViewKey.of(tenantId, ENGINEER_ACTIVITY_VIEW),
        EngineerActivityResponse.class,
        () -> computeEngineerActivity(tenantId));
  }

  /**
   * Open jobs and quotes with valid coordinates. Engineers only see the jobs assigned to them.
   *
   * @param memberId login subject of the caller, used to scope engineer pins
   */
  public MapPinsResponse getMapPins(String tenantId, RoleNamespace namespace, String memberId) {
    String audience = namespace == RoleNamespace.ENGINEER ? memberId : "all";
    return viewRenderer.render(
        ViewKey.of(tenantId, MAP_PINS_VIEW, namespace, audience),
        MapPinsResponse.class,
        () -> computeMapPins(tenantId, namespace, memberId));
  }

  /**
   * Lists the newest jobs first, then looks up invoices, snags and time entries for exactly those
   * jobs. The lookups are bounded by the listed ids, so they need no row cap of their own.
   */
  private Rendered<HealthFlagsResponse> computeHealthFlags(String tenantId) {
    Instant since = clock.instant().minus(properties.flagsWindow());

    var listing = sourceFanOut.begin(HEALTH_FLAGS_VIEW, tenantId);
    var jobs =
        listing.submit(
            "jobs", () -> jobSource.jobIdsCreatedSince(tenantId, since, properties.flagsCap()));
    List<UUID> jobIds = listing.awaitAll().requireAvailable().records(jobs);
    if (jobIds.isEmpty()) {
      return new Rendered<>(HealthFlagsResponse.of(new LinkedHashMap<>()), false);
    }

    var lookups = sourceFanOut.begin(HEALTH_FLAGS_VIEW, tenantId);
    var invoiced = lookups.submit("invoices", () -> invoiceSource.invoicedJobIds(tenantId, jobIds));
    var snagged = lookups.submit("snags", () -> jobSource.jobIdsWithOpenSnags(tenantId, jobIds));
    var unsubmitted =
        lookups.submit(
            "timesheets", () -> timesheetSource.jobIdsWithUnsubmittedTime(tenantId, jobIds));
    FanOutResult result = lookups.awaitAll();

    var flags =
        JobHealthFlagger.flag(
            jobIds,
            result.records(invoiced),
            result.records(snagged),
            result.records(unsubmitted));
    log.debug("Health flags built: tenant={}, jobs={}", tenantId, flags.size());
    return Rendered.of(HealthFlagsResponse.of(flags), result);
  }

  /**
   * Status counts, pending quotes, unpaid invoices and revenue for the current month in the
   * dashboard zone. Monthly revenue totals are exact; the daily breakdown reads at most the
   * counting row cap of paid invoices.
   */
  private Rendered<DashboardSummaryResponse> computeSummary(String tenantId) {
    Instant now = clock.instant();
    ZoneId zone = properties.zoneId();
    YearMonth month = YearMonth.from(LocalDate.ofInstant(now, zone));
    Instant monthStart = month.atDay(1).atStartOfDay(zone).toInstant();
    Instant nextMonthStart = month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
    Instant lastMonthStart = month.minusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
    int rowCap = sourceFanOut.countingRowCap();

    var fanOut = sourceFanOut.begin(SUMMARY_VIEW, tenantId);
    var jobCounts = fanOut.submit("jobs", () -> jobSource.countsByStatus(tenantId));
    var quoteTotals = fanOut.submit("quotes", () -> quoteSource.totalsByStatus(tenantId));
    var unpaid =
        fanOut.submit("invoices", () -> List.of(invoiceSource.unpaidTotals(tenantId, now)));
    var paidThisMonth =
        fanOut.submit(
            "revenue",
            () -> List.of(invoiceSource.paidTotal(tenantId, monthStart, nextMonthStart)));
    var paidLastMonth =
        fanOut.submit(
            "revenue-previous",
            () -> List.of(invoiceSource.paidTotal(tenantId, lastMonthStart, monthStart)));
    var payments =
        fanOut.submit(
            "payments",
            () -> invoiceSource.paidBetween(tenantId, monthStart, nextMonthStart, rowCap));
    var submitted =
        fanOut.submit("timesheets", () -> List.of(timesheetSource.submittedCount(tenantId)));
    var enquiries = fanOut.submit("enquiries", () -> List.of(enquirySource.openCount(tenantId)));
    var engineers =
        fanOut.submit("engineers", () -> timesheetSource.engineers(tenantId, properties.teamCap()));
    FanOutResult result = fanOut.awaitAll().requireAvailable();

    var quoteRows = result.records(quoteTotals);
    var counts =
        new SummaryCounts(
            DashboardSummarizer.jobCounts(result.records(jobCounts)),
            DashboardSummarizer.quoteCounts(quoteRows),
            first(result.records(submitted), 0L));
    var team = new ArrayList<TeamMember>();
    for (EngineerRecord engineer : result.records(engineers)) {
      team.add(new TeamMember(engineer.id(), engineer.name()));
    }
    var summary =
        DashboardSummaryResponse.of(
            counts,
            DashboardSummarizer.pendingQuotes(quoteRows),
            DashboardSummarizer.invoices(first(result.records(unpaid), (UnpaidInvoiceTotals) null)),
            new EnquirySummary(first(result.records(enquiries), 0L)),
            DashboardSummarizer.revenue(
                month,
                zone,
                result.records(payments),
                first(result.records(paidThisMonth), BigDecimal.ZERO),
                first(result.records(paidLastMonth), BigDecimal.ZERO)),
            team);
    log.debug("Dashboard summary built: tenant={}, month={}", tenantId, month);
    return Rendered.of(summary, result);
  }

  private static <T> T first(List<T> records, T fallback) {
    return records.isEmpty() ? fallback : records.get(0);
  }

  private Rendered<EngineerActivityResponse> computeEngineerActivity(String tenantId) {
    ZoneId zone = properties.zoneId();
    LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
    Instant dayStart = today.atStartOfDay(zone).toInstant();
    Instant dayEnd = today.plusDays(1).atStartOfDay(zone).toInstant();

    var fanOut = sourceFanOut.begin(ENGINEER_ACTIVITY_VIEW, tenantId);
    var engineers =
        fanOut.submit(
            "engineers",
            () -> timesheetSource.engineers(tenantId, sourceFanOut.countingRowCap()));
    var lastActive = fanOut.submit("time-entries", () -> timesheetSource.lastActive(tenantId));
    var scheduled =
        fanOut.submit("jobs", () -> jobSource.scheduledJobCounts(tenantId, dayStart, dayEnd));
    FanOutResult result = fanOut.awaitAll().requireAvailable();

    Map<UUID, Instant> lastActiveByEngineer = new HashMap<>();
    for (EngineerLastActive row : result.records(lastActive)) {
      lastActiveByEngineer.put(row.engineerId(), row.lastActive());
    }
    Map<UUID, Long> jobsByEngineer = new HashMap<>();
    for (ScheduledJobCount row : result.records(scheduled)) {
      jobsByEngineer.put(row.engineerId(), row.jobCount());
    }

    var activity = new LinkedHashMap<String, EngineerActivity>();
    for (EngineerRecord engineer : result.records(engineers)) {
      activity.put(
          engineer.id().toString(),
          new EngineerActivity(
              lastActiveByEngineer.get(engineer.id()),
              Math.toIntExact(jobsByEngineer.getOrDefault(engineer.id(), 0L))));
    }
    return Rendered.of(EngineerActivityResponse.of(activity), result);
  }

  private Rendered<MapPinsResponse> computeMapPins(
      String tenantId, RoleNamespace namespace, String memberId) {
    int pinCap = properties.pinCap();

    var fanOut = sourceFanOut.begin(MAP_PINS_VIEW, tenantId);
    var jobPins =
        fanOut.submit(
            "jobs",
            () ->
                namespace == RoleNamespace.ENGINEER
                    ? jobSource.openJobPinsAssignedTo(tenantId, memberId, pinCap)
                    : jobSource.openJobPins(tenantId, pinCap));
    var quotePins =
        namespace == RoleNamespace.ENGINEER
            ? null
            : fanOut.submit("quotes", () -> quoteSource.openQuotePins(tenantId, pinCap));
    FanOutResult result = fanOut.awaitAll().requireAvailable();

    var pins = new ArrayList<MapPin>();
    for (JobPinRecord job : result.records(jobPins)) {
      if (isValidCoordinate(job.latitude(), job.longitude())) {
        pins.add(toPin(job, namespace));
      }
    }
    if (quotePins != null) {
      for (QuotePinRecord quote : result.records(quotePins)) {
        if (isValidCoordinate(quote.latitude(), quote.longitude())) {
          pins.add(toPin(quote, namespace));
        }
      }
    }
    return Rendered.of(MapPinsResponse.of(pins), result);
  }

  static boolean isValidCoordinate(Double lat, Double lng) {
    return lat != null
        && lng != null
        && Double.isFinite(lat)
        && Double.isFinite(lng)
        && lat >= -90
        && lat <= 90
        && lng >= -180
        && lng <= 180;
  }

  private static MapPin toPin(JobPinRecord job, RoleNamespace namespace) {
    var ref = DisplayRef.of(job.jobNumber(), job.id());
    SafeText label =
        job.title() != null && !job.title().isBlank()
            ? SafeText.format("Job #%s: %s", ref, DisplayName.of(job.title(), ""))
            : SafeText.format("Job #%s", ref);
    return new MapPin(
        "job-" + job.id(),
        MapPinType.JOB,
        job.latitude(),
        job.longitude(),
        label,
        namespace.path("jobs", job.id()),
        job.status());
  }

  private static MapPin toPin(QuotePinRecord quote, RoleNamespace namespace) {
    return new MapPin(
        "quote-" + quote.id(),
        MapPinType.QUOTE,
        quote.latitude(),
        quote.longitude(),
        SafeText.format(
            "Quote #%s for %s",
            DisplayRef.of(quote.quoteNumber(), quote.id()),
            DisplayName.of(quote.clientName(), "a client")),
        namespace.path("quotes", quote.id()),
        quote.status());
  }
}
