package io.tradedesk.opsengine.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_TENANT_ID = "tenantId";
  static final String MDC_USER_ID = "userId";
  static final String MDC_ROLE = "role";
  static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String tenantId = RequestScopes.getTenantIdOrNull();
      if (tenantId != null) {
        MDC.put(MDC_TENANT_ID, tenantId);
      }
      if (RequestScopes.MEMBER_ID.isBound()) {
        MDC.put(MDC_USER_ID, RequestScopes.MEMBER_ID.get());
      }
      String role = RequestScopes.getOrgRole();
      if (role != null) {
        MDC.put(MDC_ROLE, role);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_ROLE);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
