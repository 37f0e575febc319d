package io.tradedesk.opsengine.attention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
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

/**
 * Attention endpoint against seeded rows: one tenant with a finding of every type, one empty
 * tenant.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AttentionIntegrationTest {

  private static final String ORG_ID = "org_attention_test";
  private static final String EMPTY_ORG_ID = "org_attention_empty";

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID staleInvoiceId;
  private UUID unbilledJobId;

  @BeforeAll
  void seed() {
    Instant now = Instant.now();
    var data = TestTenantData.provision(jdbcTemplate, ORG_ID, "tenant_attention");
    TestTenantData.provision(jdbcTemplate, EMPTY_ORG_ID, "tenant_attention_empty");

    UUID acme = data.client("Acme Ltd");

    // overdue invoices: 40 days (700) and 5 days (350)
    staleInvoiceId =
        data.invoice(
            acme, null, "INV-2", "Acme Ltd", "sent", daysAgo(now, 70), daysAgo(now, 40), null);
    data.invoice(acme, null, "INV-1", "Acme Ltd", "overdue", daysAgo(now, 35), daysAgo(now, 5), null);

    // completed 10 days ago, no invoice (250), with two open snags (160)
    unbilledJobId = data.job("J-100", "Rewire", "completed", acme, daysAgo(now, 20), daysAgo(now, 10));
    data.snag(unbilledJobId, "open");
    data.snag(unbilledJobId, "open");
    data.snag(unbilledJobId, "resolved");

    // completed too recently to flag
    data.job("J-101", "Sockets", "completed", acme, daysAgo(now, 3), daysAgo(now, 1));

    // completed and invoiced
    UUID billed = data.job("J-102", "Lighting", "completed", acme, daysAgo(now, 20), daysAgo(now, 10));
    data.invoice(acme, billed, "INV-3", "Acme Ltd", "paid", daysAgo(now, 9), daysAgo(now, 1), daysAgo(now, 2));

    // completed and soft-deleted
    UUID deleted = data.job("J-104", "Gone", "completed", acme, daysAgo(now, 20), daysAgo(now, 10));
    data.softDeleteJob(deleted);

    // certificate completed 3 days ago, not issued (165)
    data.certificate(unbilledJobId, "EICR-1", "EICR", "completed", daysAgo(now, 3), null);

    // accepted quote without a job (200), and one that has its job
    data.quote(acme, null, "Q-1", "Acme Ltd", "accepted", daysAgo(now, 12), daysAgo(now, 10));
    UUID converted =
        data.quote(acme, null, "Q-2", "Acme Ltd", "accepted", daysAgo(now, 12), daysAgo(now, 10));
    UUID convertedJob = data.job("J-103", "Board swap", "scheduled", acme, daysAgo(now, 9), null);
    data.linkJobToQuote(convertedJob, converted);

    // unsubmitted time (50), ranked out by the cap
    UUID sam = data.engineer("user_att_sam", "Sam Spark");
    data.timeEntry(sam, convertedJob, null, daysAgo(now, 2));
  }

  private static Instant daysAgo(Instant now, long days) {
    return now.minus(Duration.ofDays(days)).minusSeconds(60);
  }

  @Test
  void returnsTopSixFindingsMostUrgentFirst() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention").with(TestJwts.member(ORG_ID, "user_att_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.items", hasSize(6)))
        .andExpect(jsonPath("$.items[0].id").value("invoice_overdue_" + staleInvoiceId))
        .andExpect(jsonPath("$.items[0].type").value("invoice_overdue"))
        .andExpect(jsonPath("$.items[0].icon").value("clock"))
        .andExpect(jsonPath("$.items[0].urgency").value(700))
        .andExpect(jsonPath("$.items[0].message").value("Invoice #INV-2 to Acme Ltd is overdue"))
        .andExpect(jsonPath("$.items[0].age").value("40 days overdue"))
        .andExpect(jsonPath("$.items[0].ctaLabel").value("Chase payment"))
        .andExpect(jsonPath("$.items[0].ctaHref").value("/admin/invoices/" + staleInvoiceId))
        .andExpect(jsonPath("$.items[1].urgency").value(350))
        .andExpect(jsonPath("$.items[2].type").value("job_no_invoice"))
        .andExpect(jsonPath("$.items[2].message").value("Job #J-100 completed, no invoice created"))
        .andExpect(jsonPath("$.items[2].ctaHref").value("/admin/jobs/" + unbilledJobId))
        .andExpect(jsonPath("$.items[3].type").value("quote_no_job"))
        .andExpect(jsonPath("$.items[3].message").value("Quote #Q-1 accepted, no job created"))
        .andExpect(jsonPath("$.items[4].type").value("cert_not_issued"))
        .andExpect(jsonPath("$.items[5].type").value("open_snags"))
        .andExpect(jsonPath("$.items[5].message").value("Job #J-100 has 2 open snags"))
        .andExpect(jsonPath("$.items[5].urgency").value(160));
  }

  @Test
  void officeLinksUseOfficeNamespace() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention").with(TestJwts.member(ORG_ID, "user_att_office", "office")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].ctaHref", startsWith("/office/")))
        .andExpect(jsonPath("$.items[5].ctaHref", startsWith("/office/")));
  }

  @Test
  void emptyTenantReturnsEmptyList() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention")
                .with(TestJwts.member(EMPTY_ORG_ID, "user_att_empty", "owner")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.items", hasSize(0)));
  }

  @Test
  void repeatedCallsAreIdentical() throws Exception {
    String first =
        mockMvc
            .perform(
                get("/api/dashboard/attention")
                    .with(TestJwts.member(ORG_ID, "user_att_admin", "admin")))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    String second =
        mockMvc
            .perform(
                get("/api/dashboard/attention")
                    .with(TestJwts.member(ORG_ID, "user_att_admin", "admin")))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();

    assertThat(second).isEqualTo(first);
  }

  @Test
  void engineerCannotSeeAttention() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention")
                .with(TestJwts.member(ORG_ID, "user_att_sam", "engineer")))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("forbidden"));
  }

  @Test
  void portalClientCannotSeeAttention() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention")
                .with(TestJwts.portalClient(ORG_ID, "user_att_client", UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }
}
