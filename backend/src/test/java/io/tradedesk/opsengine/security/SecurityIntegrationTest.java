package io.tradedesk.opsengine.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.tradedesk.opsengine.TestcontainersConfiguration;
import io.tradedesk.opsengine.testutil.TestJwts;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class SecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void requestWithoutTokenIsUnauthenticated() throws Exception {
    mockMvc
        .perform(get("/api/dashboard/attention"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("unauthenticated"));
  }

  @Test
  void everyReadEndpointRequiresToken() throws Exception {
    for (String path :
        new String[] {
          "/api/timeline",
          "/api/portal/timeline",
          "/api/jobs/health-flags",
          "/api/engineers/activity",
          "/api/dashboard/map-pins",
          "/api/dashboard/summary",
          "/api/dashboard/activity"
        }) {
      mockMvc.perform(get(path)).andExpect(status().isUnauthorized());
    }
  }

  @Test
  void unprovisionedOrganizationIsForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/dashboard/attention")
                .with(TestJwts.member("org_never_provisioned", "user_x", "admin")))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("forbidden"))
        .andExpect(jsonPath("$.message").value("Organization not provisioned"));
  }

  @Test
  void healthEndpointIsPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }
}
