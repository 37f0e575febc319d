package io.tradedesk.opsengine.dashboard;

import io.tradedesk.opsengine.dashboard.dto.DashboardSummaryResponse;
import io.tradedesk.opsengine.dashboard.dto.EngineerActivityResponse;
import io.tradedesk.opsengine.dashboard.dto.HealthFlagsResponse;
import io.tradedesk.opsengine.dashboard.dto.MapPinsResponse;
import io.tradedesk.opsengine.multitenancy.RequestScopes;
import io.tradedesk.opsengine.security.RoleNamespace;
import io.tradedesk.opsengine.timeline.TimelineService;
import io.tradedesk.opsengine.timeline.dto.TimelineResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the operations dashboard widgets. */
@RestController
public class DashboardController {

  private final DashboardService dashboardService;
  private final TimelineService timelineService;

  public DashboardController(DashboardService dashboardService, TimelineService timelineService) {
    this.dashboardService = dashboardService;
    this.timelineService = timelineService;
  }

  /** Headline counts, unpaid invoices, this month's revenue and the team list. */
  @GetMapping("/api/dashboard/summary")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<DashboardSummaryResponse> getSummary() {
    String tenantId = RequestScopes.requireTenantId();
    return ResponseEntity.ok(dashboardService.getSummary(tenantId));
  }

  /** Invoice, snag and timesheet flags for every job created in the flag window. */
  @GetMapping("/api/jobs/health-flags")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<HealthFlagsResponse> getHealthFlags() {
    String tenantId = RequestScopes.requireTenantId();
    return ResponseEntity.ok(dashboardService.getHealthFlags(tenantId));
  }

  /** Last clocked activity and today's scheduled job count per engineer. */
  @GetMapping("/api/engineers/activity")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<EngineerActivityResponse> getEngineerActivity() {
    String tenantId = RequestScopes.requireTenantId();
    return ResponseEntity.ok(dashboardService.getEngineerActivity(tenantId));
  }

  @GetMapping("/api/dashboard/map-pins")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE', 'ORG_ENGINEER')")
  public ResponseEntity<MapPinsResponse> getMapPins() {
    String tenantId = RequestScopes.requireTenantId();
    String memberId = RequestScopes.requireMemberId();
    RoleNamespace namespace = RoleNamespace.forRole(RequestScopes.getOrgRole());
    return ResponseEntity.ok(dashboardService.getMapPins(tenantId, namespace, memberId));
  }

  /** Ten most recent changes across the tenant. */
  @GetMapping("/api/dashboard/activity")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<TimelineResponse> getRecentActivity() {
    String tenantId = RequestScopes.requireTenantId();
    RoleNamespace namespace = RoleNamespace.forRole(RequestScopes.getOrgRole());
    return ResponseEntity.ok(timelineService.getRecentActivity(tenantId, namespace));
  }
}
