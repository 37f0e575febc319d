package io.tradedesk.opsengine.aggregation;

import java.util.Objects;

/**
 * Cache key of a rendered view: tenant, view name and every parameter that changes the payload
 * (role namespace, entity scope).
 */
public record ViewKey(String tenantId, String view, String scope) {

  public ViewKey {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(view, "view");
    scope = scope != null ? scope : "";
  }

  public static ViewKey of(String tenantId, String view, Object... scopeParts) {
    var scope = new StringBuilder();
    for (Object part : scopeParts) {
      if (scope.length() > 0) {
        scope.append(':');
      }
      scope.append(part);
    }
    return new ViewKey(tenantId, view, scope.toString());
  }
}
