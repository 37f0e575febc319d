package io.tradedesk.opsengine.timeline;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
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

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TimelineIntegrationTest {

  private static final String ORG_ID = "org_timeline_test";
  private static final String OTHER_ORG_ID = "org_timeline_other";

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID clientId;
  private UUID jobId;
  private UUID recentInvoiceId;
  private UUID certificateId;
  private UUID draftInvoiceId;
  private UUID otherTenantJobId;

  @BeforeAll
  void seed() {
    Instant now = Instant.now();
    var data = TestTenantData.provision(jdbcTemplate, ORG_ID, "tenant_timeline");

    clientId = data.client("Acme Ltd");
    UUID site = data.site("Mill House", "Leeds", 53.8, -1.55);
    jobId = data.job("J-200", "Rewire", "completed", clientId, now.minus(Duration.ofDays(5)),
        now.minus(Duration.ofDays(2)));
    data.scheduleJob(jobId, site, null, null);

    data.invoice(clientId, jobId, "INV-199", "Acme Ltd", "sent", now.minus(Duration.ofDays(4)),
        now.plus(Duration.ofDays(10)), null);
    recentInvoiceId =
        data.invoice(clientId, jobId, "INV-200", "Acme Ltd", "sent", now.minus(Duration.ofDays(1)),
            now.plus(Duration.ofDays(29)), null);
    certificateId =
        data.certificate(jobId, "EICR-9", "EICR", "issued", now.minus(Duration.ofDays(1)),
            now.minus(Duration.ofHours(3)));
    draftInvoiceId =
        data.invoice(clientId, null, "INV-201", "Acme Ltd", "draft", null, null, null);
    data.quote(clientId, site, "Q-50", "Acme Ltd", "sent", now.minus(Duration.ofDays(6)), null);
    data.quote(clientId, site, "Q-51", "Acme Ltd", "draft", now.minus(Duration.ofDays(6)), null);
    data.deal(clientId, "Office refit", "proposal", now.minus(Duration.ofDays(8)));

    var other = TestTenantData.provision(jdbcTemplate, OTHER_ORG_ID, "tenant_timeline_other");
    UUID otherClient = other.client("Elsewhere Ltd");
    otherTenantJobId =
        other.job("J-1", "Other", "scheduled", otherClient, now.minus(Duration.ofDays(1)), null);
  }

  @Test
  void jobTimelineReturnsThreeNewestFacts() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityId", jobId.toString())
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.items", hasSize(3)))
        .andExpect(jsonPath("$.items[0].id").value("cert-" + certificateId))
        .andExpect(jsonPath("$.items[0].kind").value("certificate"))
        .andExpect(jsonPath("$.items[0].title").value("Electrical Condition Report"))
        .andExpect(
            jsonPath("$.items[0].documentLink")
                .value("/admin/certificates/" + certificateId + "/pdf"))
        .andExpect(jsonPath("$.items[1].id").value("inv-" + recentInvoiceId))
        .andExpect(jsonPath("$.items[1].title").value("Invoice INV-200"))
        .andExpect(jsonPath("$.items[2].id").value("job-done-" + jobId))
        .andExpect(jsonPath("$.items[2].title").value("Work completed"));
  }

  @Test
  void clientTimelineIsCappedAtThree() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityType", "client")
                .param("entityId", clientId.toString())
                .with(TestJwts.member(ORG_ID, "user_tl_office", "office")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items", hasSize(3)))
        .andExpect(jsonPath("$.items[*].link", everyItem(startsWith("/office/"))));
  }

  @Test
  void missingEntityIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/timeline").with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("bad_request"))
        .andExpect(jsonPath("$.message").value("Parameter 'entityId' is required"));
  }

  @Test
  void malformedEntityIdIsBadRequest() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityId", "not-a-uuid")
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownEntityTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityType", "invoice")
                .param("entityId", jobId.toString())
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityId", UUID.randomUUID().toString())
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void jobOfAnotherTenantIsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityId", otherTenantJobId.toString())
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isNotFound());
  }

  @Test
  void unknownClientIsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityType", "client")
                .param("entityId", UUID.randomUUID().toString())
                .with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isNotFound());
  }

  @Test
  void portalFeedShowsOnlySharedRecordsWithClientLinks() throws Exception {
    mockMvc
        .perform(
            get("/api/portal/timeline")
                .with(TestJwts.portalClient(ORG_ID, "user_tl_client", clientId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.items", hasSize(6)))
        .andExpect(jsonPath("$.items[*].id", not(hasItem("inv-" + draftInvoiceId))))
        .andExpect(jsonPath("$.items[*].link", everyItem(startsWith("/client/"))))
        .andExpect(jsonPath("$.items[*].subtitle", not(hasItem("Acme Ltd"))));
  }

  @Test
  void portalClientWithoutCustomerIsForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/portal/timeline").with(TestJwts.member(ORG_ID, "user_tl_client", "client")))
        .andExpect(status().isForbidden());
  }

  @Test
  void operatorsCannotReadPortalFeed() throws Exception {
    mockMvc
        .perform(
            get("/api/portal/timeline").with(TestJwts.member(ORG_ID, "user_tl_admin", "admin")))
        .andExpect(status().isForbidden());
  }

  @Test
  void portalClientCannotReadOperatorTimeline() throws Exception {
    mockMvc
        .perform(
            get("/api/timeline")
                .param("entityId", jobId.toString())
                .with(TestJwts.portalClient(ORG_ID, "user_tl_client", clientId)))
        .andExpect(status().isForbidden());
  }
}
