package io.tradedesk.opsengine.security;

import io.tradedesk.opsengine.exception.ForbiddenException;
import java.util.UUID;

/**
 * Path namespace every navigable link is built under. A caller only ever receives links inside
 * its own namespace.
 */
public enum RoleNamespace {
  ADMIN("/admin"),
  OFFICE("/office"),
  ENGINEER("/engineer"),
  CLIENT("/client");

  private final String prefix;

  RoleNamespace(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  /** Builds {@code <prefix>/<collection>}. */
  public String path(String collection) {
    return prefix + "/" + collection;
  }

  /** Builds {@code <prefix>/<collection>/<id>}. */
  public String path(String collection, UUID id) {
    return path(collection) + "/" + id;
  }

  /** Builds {@code <prefix>/<collection>/<key>} for non-UUID keys such as public tokens. */
  public String path(String collection, String key) {
    return path(collection) + "/" + key;
  }

  /** Builds {@code <prefix>/<collection>/<key>/<suffix>}. */
  public String path(String collection, String key, String suffix) {
    return path(collection) + "/" + key + "/" + suffix;
  }

  /**
   * Resolves the namespace for an org role.
   *
   * @throws ForbiddenException when the role is missing or unknown
   */
  public static RoleNamespace forRole(String orgRole) {
    if (orgRole == null) {
      throw new ForbiddenException("Access denied", "No role on this session");
    }
    return switch (orgRole) {
      case Roles.ORG_OWNER, Roles.ORG_ADMIN -> ADMIN;
      case Roles.ORG_OFFICE -> OFFICE;
      case Roles.ORG_ENGINEER -> ENGINEER;
      case Roles.PORTAL_CLIENT -> CLIENT;
      default -> throw new ForbiddenException("Access denied", "Unrecognised role");
    };
  }
}
