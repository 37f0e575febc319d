package io.tradedesk.opsengine.multitenancy;

import io.tradedesk.opsengine.exception.ForbiddenException;
import io.tradedesk.opsengine.exception.MissingOrganizationContextException;
import java.util.UUID;

/**
 * Request-scoped values for multitenancy and caller identity. Bound by servlet filters, read by
 * controllers and services.
 *
 * <p>Values are immutable within their scope and unbound when the binding carrier's run/call
 * exits. Source adapters never read these: the tenant is passed to them explicitly because they
 * execute on fan-out worker threads.
 */
public final class RequestScopes {

  /** Tenant identifier (e.g. "tenant_a1b2c3d4e5f6"). Bound by TenantFilter. */
  public static final RequestScope<String> TENANT_ID = new RequestScope<>("TENANT_ID");

  /** Clerk organization ID (e.g. "org_abc123"). Bound by TenantFilter. */
  public static final RequestScope<String> ORG_ID = new RequestScope<>("ORG_ID");

  /** Authenticated user's subject. Bound by MemberFilter. */
  public static final RequestScope<String> MEMBER_ID = new RequestScope<>("MEMBER_ID");

  /** Caller's org role ("owner", "admin", "office", "engineer", "client"). Bound by MemberFilter. */
  public static final RequestScope<String> ORG_ROLE = new RequestScope<>("ORG_ROLE");

  /** Portal client's customer UUID. Bound by MemberFilter for client-role tokens. */
  public static final RequestScope<UUID> CUSTOMER_ID = new RequestScope<>("CUSTOMER_ID");

  public static <T> ScopeCarrier where(RequestScope<T> scope, T value) {
    return ScopeCarrier.of(scope, value);
  }

  /** Returns the caller's subject. Throws if not bound by filter chain. */
  public static String requireMemberId() {
    if (!MEMBER_ID.isBound()) {
      throw new MemberContextNotBoundException();
    }
    return MEMBER_ID.get();
  }

  /** Returns the caller's org role, or null if not bound. */
  public static String getOrgRole() {
    return ORG_ROLE.isBound() ? ORG_ROLE.get() : null;
  }

  /** Returns the tenant identifier. Throws if the token carried no provisioned organization. */
  public static String requireTenantId() {
    if (!TENANT_ID.isBound()) {
      throw new MissingOrganizationContextException();
    }
    return TENANT_ID.get();
  }

  /** Returns the tenant identifier, or null if not bound. */
  public static String getTenantIdOrNull() {
    return TENANT_ID.isBound() ? TENANT_ID.get() : null;
  }

  /**
   * Returns the portal customer's UUID.
   *
   * @throws ForbiddenException if the token carried no usable customer claim
   */
  public static UUID requireCustomerId() {
    if (!CUSTOMER_ID.isBound()) {
      throw new ForbiddenException("Access denied", "No customer is linked to this session");
    }
    return CUSTOMER_ID.get();
  }

  private RequestScopes() {}
}
