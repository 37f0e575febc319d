package io.tradedesk.opsengine.attention;

import io.tradedesk.opsengine.attention.dto.AttentionResponse;
import io.tradedesk.opsengine.multitenancy.RequestScopes;
import io.tradedesk.opsengine.security.RoleNamespace;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AttentionController {

  private final AttentionService attentionService;

  public AttentionController(AttentionService attentionService) {
    this.attentionService = attentionService;
  }

  /** Up to six findings that need an operator, most urgent first. */
  @GetMapping("/api/dashboard/attention")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_OFFICE')")
  public ResponseEntity<AttentionResponse> getAttention() {
    String tenantId = RequestScopes.requireTenantId();
    RoleNamespace namespace = RoleNamespace.forRole(RequestScopes.getOrgRole());
    return ResponseEntity.ok(attentionService.getAttention(tenantId, namespace));
  }
}
