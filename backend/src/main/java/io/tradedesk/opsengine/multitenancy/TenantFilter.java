package io.tradedesk.opsengine.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tradedesk.opsengine.exception.ErrorEnvelopeWriter;
import io.tradedesk.opsengine.security.ClerkJwtUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final OrgTenantMappingRepository mappingRepository;
  private final ErrorEnvelopeWriter envelopeWriter;
  private final Cache<String, String> tenantCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public TenantFilter(
      OrgTenantMappingRepository mappingRepository, ErrorEnvelopeWriter envelopeWriter) {
    this.mappingRepository = mappingRepository;
    this.envelopeWriter = envelopeWriter;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      String orgId = ClerkJwtUtils.extractOrgId(jwt);

      if (orgId != null) {
        String tenantId = resolveTenant(orgId);
        if (tenantId != null) {
          ScopedFilterChain.runScoped(
              RequestScopes.where(RequestScopes.TENANT_ID, tenantId)
                  .where(RequestScopes.ORG_ID, orgId),
              filterChain,
              request,
              response);
          return;
        }
        log.warn("Organization not provisioned: org={}, path={}", orgId, request.getRequestURI());
        envelopeWriter.write(response, HttpStatus.FORBIDDEN, "Organization not provisioned");
        return;
      }
    }

    // No JWT or no org claim - continue unbound (actuator, unauthenticated paths)
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private String resolveTenant(String clerkOrgId) {
    // Caffeine's cache.get(key, loader) throws NPE if loader returns null.
    // Use getIfPresent + manual put to handle unprovisioned orgs gracefully.
    String cached = tenantCache.getIfPresent(clerkOrgId);
    if (cached != null) {
      return cached;
    }
    String tenantId =
        mappingRepository
            .findByClerkOrgId(clerkOrgId)
            .map(OrgTenantMapping::getTenantId)
            .orElse(null);
    if (tenantId != null) {
      tenantCache.put(clerkOrgId, tenantId);
    }
    return tenantId;
  }
}
