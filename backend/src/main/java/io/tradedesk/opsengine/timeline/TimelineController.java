package io.tradedesk.opsengine.timeline;

import io.tradedesk.opsengine.exception.InvalidStateException;
import io.tradedesk.opsengine.multitenancy.RequestScopes;
import io.tradedesk.opsengine.security.RoleNamespace;
import io.tradedesk.opsengine.timeline.dto.TimelineResponse;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimelineController {

  private final TimelineService timelineService;

  public TimelineController(TimelineService timelineService) {
    this.timelineService = timelineService;
  }

  /**
   * Three most recent facts about a job or client. {@code entityId} is required; {@code
   * entityType} defaults to job.
   */
  @GetMapping("/api/timeline")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<TimelineResponse> getEntityTimeline(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) String entityId) {
    TimelineScope scope = TimelineScope.fromParameter(entityType);
    UUID id = parseEntityId(entityId);
    String tenantId = RequestScopes.requireTenantId();
    RoleNamespace namespace = RoleNamespace.forRole(RequestScopes.getOrgRole());

    return ResponseEntity.ok(timelineService.getEntityTimeline(tenantId, scope, id, namespace));
  }

  /** The signed-in client's own activity feed. */
  @GetMapping("/api/portal/timeline")
  @PreAuthorize("hasRole('PORTAL_CLIENT')")
  public ResponseEntity<TimelineResponse> getPortalTimeline() {
    String tenantId = RequestScopes.requireTenantId();
    UUID customerId = RequestScopes.requireCustomerId();
    return ResponseEntity.ok(timelineService.getPortalTimeline(tenantId, customerId));
  }

  private static UUID parseEntityId(String entityId) {
    if (entityId == null || entityId.isBlank()) {
      throw new InvalidStateException("Missing entity id", "Parameter 'entityId' is required");
    }
    try {
      return UUID.fromString(entityId.strip());
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid entity id", "Parameter 'entityId' must be a valid identifier");
    }
  }
}
