package io.tradedesk.opsengine.dashboard;

import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.tradedesk.opsengine.TestcontainersConfiguration;
import io.tradedesk.opsengine.testutil.TestJwts;
import io.tradedesk.opsengine.testutil.TestTenantData;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
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
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

/** Row caps far below the seeded volume must shorten lists without corrupting what is listed. */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestPropertySource(
    properties = {
      "ops.sources.row-cap=2",
      "ops.sources.counting-row-cap=2",
      "ops.dashboard.flags-cap=3"
    })
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SourceCapsIntegrationTest {

  private static final String FLAGS_ORG_ID = "org_caps_flags";
  private static final String SNAGS_ORG_ID = "org_caps_snags";

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private final List<UUID> invoicedJobIds = new ArrayList<>();
  private UUID oldestSnaggedJobId;
  private UUID olderSnaggedJobId;

  @BeforeAll
  void seed() {
    Instant now = Instant.now();

    var flags = TestTenantData.provision(jdbcTemplate, FLAGS_ORG_ID, "tenant_caps_flags");
    UUID acme = flags.client("Acme Ltd");
    for (int i = 0; i < 5; i++) {
      UUID jobId =
          flags.job(
              "J-50" + i, "Job " + i, "in_progress", acme, now.minus(Duration.ofHours(i + 1)), null);
      flags.invoice(
          acme, jobId, "INV-50" + i, "Acme Ltd", "sent", now, now.plus(Duration.ofDays(30)), null);
      invoicedJobIds.add(jobId);
    }

    var snags = TestTenantData.provision(jdbcTemplate, SNAGS_ORG_ID, "tenant_caps_snags");
    UUID mill = snags.client("Mill Co");
    oldestSnaggedJobId =
        snags.job("J-60", "Oldest", "completed", mill, now.minus(Duration.ofDays(40)), now.minus(Duration.ofDays(30)));
    olderSnaggedJobId =
        snags.job("J-61", "Older", "completed", mill, now.minus(Duration.ofDays(25)), now.minus(Duration.ofDays(20)));
    UUID recentSnaggedJobId =
        snags.job("J-62", "Recent", "completed", mill, now.minus(Duration.ofDays(6)), now.minus(Duration.ofDays(5)));
    for (UUID jobId : List.of(oldestSnaggedJobId, olderSnaggedJobId, recentSnaggedJobId)) {
      snags.invoice(mill, jobId, "INV-" + jobId, "Mill Co", "paid", now, now, now);
    }
    snags.snag(oldestSnaggedJobId, "open");
    snags.snag(oldestSnaggedJobId, "open");
    snags.snag(oldestSnaggedJobId, "open");
    snags.snag(oldestSnaggedJobId, "resolved");
    snags.snag(olderSnaggedJobId, "open");
    snags.snag(recentSnaggedJobId, "open");
    snags.snag(recentSnaggedJobId, "open");
  }

  @Test
  void everyListedJobKeepsItsInvoiceFlagWhenLookupsExceedTheCountingCap() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs/health-flags")
                .with(TestJwts.member(FLAGS_ORG_ID, "user_caps_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.flags", aMapWithSize(3)))
        .andExpect(jsonPath("$.flags['" + invoicedJobIds.get(0) + "'].hasInvoice").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobIds.get(1) + "'].hasInvoice").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobIds.get(2) + "'].hasInvoice").value(true))
        .andExpect(jsonPath("$.flags['" + invoicedJobIds.get(3) + "']").doesNotExist());
  }

  @Test
  void snagCapCountsJobsNotSnagRows() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention")
                .with(TestJwts.member(SNAGS_ORG_ID, "user_caps_admin", "admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items", hasSize(2)))
        .andExpect(jsonPath("$.items[0].id").value("open_snags_" + oldestSnaggedJobId))
        .andExpect(jsonPath("$.items[0].message").value("Job #J-60 has 3 open snags"))
        .andExpect(jsonPath("$.items[1].id").value("open_snags_" + olderSnaggedJobId))
        .andExpect(jsonPath("$.items[1].message").value("Job #J-61 has 1 open snag"));
  }
}
