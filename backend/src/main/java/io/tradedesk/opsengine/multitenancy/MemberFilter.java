package io.tradedesk.opsengine.multitenancy;

import io.tradedesk.opsengine.security.ClerkJwtUtils;
import io.tradedesk.opsengine.security.Roles;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's subject, org role and (for portal clients) customer ID once the tenant is
 * resolved. Members are not looked up in a store: the engine only needs identity claims.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (RequestScopes.TENANT_ID.isBound()
        && authentication instanceof JwtAuthenticationToken jwtAuth
        && jwtAuth.getToken().getSubject() != null) {
      Jwt jwt = jwtAuth.getToken();
      var carrier = RequestScopes.where(RequestScopes.MEMBER_ID, jwt.getSubject());
      String orgRole = ClerkJwtUtils.extractOrgRole(jwt);
      if (orgRole != null) {
        carrier = carrier.where(RequestScopes.ORG_ROLE, orgRole);
      }
      if (Roles.PORTAL_CLIENT.equals(orgRole)) {
        UUID customerId = parseCustomerId(ClerkJwtUtils.extractCustomerId(jwt));
        if (customerId != null) {
          carrier = carrier.where(RequestScopes.CUSTOMER_ID, customerId);
        }
      }
      ScopedFilterChain.runScoped(carrier, filterChain, request, response);
      return;
    }

    // No tenant or no subject - continue unbound
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private UUID parseCustomerId(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return UUID.fromString(raw);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed customer claim: {}", e.getMessage());
      return null;
    }
  }
}
