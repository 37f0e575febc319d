package io.tradedesk.opsengine.security;

/**
 * Centralized role constants used across authentication, authorization, and link scoping.
 *
 * <p>Org roles come from the Clerk JWT v2 {@code o.rol} claim. Spring authorities are the {@code
 * ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // Org-level roles (Clerk JWT v2 "o.rol" values)
  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_OFFICE = "office";
  public static final String ORG_ENGINEER = "engineer";
  public static final String PORTAL_CLIENT = "client";

  // Spring Security granted authorities
  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_OFFICE = "ROLE_ORG_OFFICE";
  public static final String AUTHORITY_ORG_ENGINEER = "ROLE_ORG_ENGINEER";
  public static final String AUTHORITY_PORTAL_CLIENT = "ROLE_PORTAL_CLIENT";

  private Roles() {}
}
