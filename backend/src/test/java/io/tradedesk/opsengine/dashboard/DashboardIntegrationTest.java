package io.tradedesk.opsengine.dashboard;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.tradedesk.opsengine.TestcontainersConfiguration;
import io.tradedesk.opsengine.testutil.TestJwts;
import io.tradedesk.opsengine.testutil.TestTenantData;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/** Health flags, engineer activity, map pins and the recent activity feed for one tenant. */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DashboardIntegrationTest {

  private static final String ORG_ID = "org_dashboard_test";

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID invoicedJobId;
  private UUID unsubmittedJobId;
  private UUID quietJobId;
  private UUID oldJobId;
  private UUID samId;
  private UUID patId;
  private UUID samOpenJobId;
  private UUID patOpenJobId;
  private UUID openQuoteId;

  @BeforeAll
  void seed() {
    Instant now = Instant.now();
    var data = TestTenantData.provision(jdbcTemplate, ORG_ID, "tenant_dashboard");
    UUID acme = data.client("Acme Ltd");
    UUID mill = data.site("Mill House", "Leeds", 53.8, -1.55);
    UUID broken = data.site("Nowhere", "Atlantis", 95.0, 0.0);

    samId = data.engineer("user_dash_sam", "Sam Spark");
    patId = data.engineer("user_dash_pat", "Pat Volt");

    invoicedJobId =
        data.job("J-300", "Rewire", "completed", acme, now.minus(Duration.ofDays(3)), now.minus(Duration.ofDays(1)));
    data.invoice(acme, invoicedJobId, "INV-300", "Acme Ltd", "sent", now.minus(Duration.ofHours(20)), now.plus(Duration.ofDays(20)), null);
    data.snag(invoicedJobId, "open");

    unsubmittedJobId = data.job("J-301", "Sockets", "in_progress", acme, now.minus(Duration.ofDays(2)), null);
    UUID draftSheet = data.timesheet(samId, "draft");
    data.timeEntry(samId, unsubmittedJobId, draftSheet, now.minus(Duration.ofHours(2)));

    quietJobId = data.job("J-302", "Survey", "completed", acme, now.minus(Duration.ofDays(1)), now.minus(Duration.ofHours(5)));
    UUID approvedSheet = data.timesheet(patId, "approved");
    data.timeEntry(patId, quietJobId, approvedSheet, now.minus(Duration.ofDays(1)));

    oldJobId = data.job("J-250", "Ancient", "completed", acme, now.minus(Duration.ofDays(200)), now.minus(Duration.ofDays(190)));

    samOpenJobId = data.job("J-310", "Boiler", "scheduled", acme, now.minus(Duration.ofHours(1)), null);
    data.scheduleJob(samOpenJobId, mill, samId, now);
    patOpenJobId = data.job("J-311", null, "scheduled", acme, now.minus(Duration.ofHours(1)), null);
    data.scheduleJob(patOpenJobId, mill, patId, now.plus(Duration.ofDays(3)));
    UUID lostJob = data.job("J-312", "Lost", "scheduled", acme, now.minus(Duration.ofHours(1)), null);
    data.scheduleJob(lostJob, broken, samId, now.plus(Duration.ofDays(2)));

    openQuoteId = data.quote(acme, mill, "Q-300", "Acme Ltd", "sent", now.minus(Duration.ofDays(1)), null);
    data.quote(acme, mill, "Q-301", "Acme Ltd", "declined", now.minus(Duration.ofDays(1)), null);

    for (int i = 0; i < 12; i++) {
      data.auditEvent(
          "quote", openQuoteId, "sent", "Jo Bloggs", "Q-300", now.minus(Duration.ofMinutes(i + 1)));
    }
  }

  @Test
  void healthFlagsCoverRecentJobs() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs/health-flags").with(TestJwts.member(ORG_ID, "user_dash_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobId + "'].hasInvoice").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobId + "'].hasOpenSnags").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobId + "'].hasMissingTimesheet").value(false))
        .andExpect(jsonPath("$.flags['" + unsubmittedJobId + "'].hasInvoice").value(false))
        .andExpect(jsonPath("$.flags['" + unsubmittedJobId + "'].hasMissingTimesheet").value(true))
        .andExpect(jsonPath("$.flags['" + quietJobId + "'].hasMissingTimesheet").value(false))
        .andExpect(jsonPath("$.flags['" + quietJobId + "'].hasOpenSnags").value(false))
        .andExpect(jsonPath("$.flags['" + oldJobId + "']").doesNotExist());
  }

  @Test
  void engineerActivityReportsLastActiveAndTodaysJobs() throws Exception {
    mockMvc
        .perform(
            get("/api/engineers/activity").with(TestJwts.member(ORG_ID, "user_dash_office", "office")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.activity['" + samId + "'].todayJobCount").value(1))
        .andExpect(jsonPath("$.activity['" + samId + "'].lastActive").isNotEmpty())
        .andExpect(jsonPath("$.activity['" + patId + "'].todayJobCount").value(0));
  }

  @Test
  void adminSeesAllOpenPinsWithValidCoordinates() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/map-pins").with(TestJwts.member(ORG_ID, "user_dash_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.pins", hasSize(3)))
        .andExpect(
            jsonPath(
                "$.pins[*].id",
                containsInAnyOrder(
                    "job-" + samOpenJobId, "job-" + patOpenJobId, "quote-" + openQuoteId)))
        .andExpect(jsonPath("$.pins[?(@.id == 'job-" + samOpenJobId + "')].label")
            .value("Job #J-310: Boiler"))
        .andExpect(jsonPath("$.pins[?(@.id == 'job-" + patOpenJobId + "')].label")
            .value("Job #J-311"))
        .andExpect(jsonPath("$.pins[?(@.id == 'quote-" + openQuoteId + "')].label")
            .value("Quote #Q-300 for Acme Ltd"))
        .andExpect(jsonPath("$.pins[?(@.id == 'quote-" + openQuoteId + "')].href")
            .value("/admin/quotes/" + openQuoteId));
  }

  @Test
  void engineerSeesOnlyOwnJobPins() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/map-pins")
                .with(TestJwts.member(ORG_ID, "user_dash_sam", "engineer")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pins", hasSize(1)))
        .andExpect(jsonPath("$.pins[0].id").value("job-" + samOpenJobId))
        .andExpect(jsonPath("$.pins[0].type").value("job"))
        .andExpect(jsonPath("$.pins[0].lat").value(53.8))
        .andExpect(jsonPath("$.pins[0].href").value("/engineer/jobs/" + samOpenJobId));
  }

  @Test
  void recentActivityIsCappedAtTen() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/activity").with(TestJwts.member(ORG_ID, "user_dash_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.items", hasSize(10)))
        .andExpect(jsonPath("$.items[0].kind").value("audit"))
        .andExpect(jsonPath("$.items[0].title").value("Quote #Q-300 sent"))
        .andExpect(jsonPath("$.items[0].subtitle").value("by Jo Bloggs"))
        .andExpect(jsonPath("$.items[0].amount").doesNotExist());
  }

  @Test
  void engineersCannotReadOfficeWidgets() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs/health-flags").with(TestJwts.member(ORG_ID, "user_dash_sam", "engineer")))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(
            get("/api/engineers/activity")
                .with(TestJwts.member(ORG_ID, "user_dash_sam", "engineer")))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(
            get("/api/dashboard/activity")
                .with(TestJwts.member(ORG_ID, "user_dash_sam", "engineer")))
        .andExpect(status().isForbidden());
  }

  @Test
  void portalClientCannotReadMap() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/map-pins")
                .with(TestJwts.portalClient(ORG_ID, "user_dash_client", UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }
}
