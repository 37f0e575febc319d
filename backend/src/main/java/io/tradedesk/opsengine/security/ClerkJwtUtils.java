package io.tradedesk.opsengine.security;

import java.util.Map;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts Clerk JWT v2 org claims from the nested "o" object.
 *
 * <p>Clerk v2 format: {@code { "o": { "id": "org_xxx", "rol": "admin", "slg": "my-org" } }}.
 * Portal client tokens additionally carry a top-level {@code customer_id} claim.
 */
public final class ClerkJwtUtils {

  private static final String ORG_CLAIM = "o";
  private static final String CUSTOMER_CLAIM = "customer_id";

  /** Extracts the org ID ({@code o.id}) from a Clerk JWT v2 token. */
  public static String extractOrgId(Jwt jwt) {
    return extractNestedClaim(jwt, "id");
  }

  /** Extracts the org role ({@code o.rol}) from a Clerk JWT v2 token. */
  public static String extractOrgRole(Jwt jwt) {
    return extractNestedClaim(jwt, "rol");
  }

  /** Extracts the portal customer ID ({@code customer_id}), or null when absent. */
  public static String extractCustomerId(Jwt jwt) {
    Object value = jwt.getClaim(CUSTOMER_CLAIM);
    return value instanceof String str ? str : null;
  }

  private static String extractNestedClaim(Jwt jwt, String key) {
    Object orgClaim = jwt.getClaim(ORG_CLAIM);
    if (orgClaim instanceof Map<?, ?> map) {
      Object value = map.get(key);
      if (value instanceof String str) {
        return str;
      }
    }
    return null;
  }

  private ClerkJwtUtils() {}
}
