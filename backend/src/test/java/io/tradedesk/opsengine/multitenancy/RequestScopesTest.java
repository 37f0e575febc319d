package io.tradedesk.opsengine.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tradedesk.opsengine.exception.ForbiddenException;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestScopesTest {

  @Test
  void tenantIdBoundWithinScope() {
    RequestScopes.where(RequestScopes.TENANT_ID, "tenant_a1b2c3d4e5f6")
        .run(
            () -> {
              assertThat(RequestScopes.TENANT_ID.get()).isEqualTo("tenant_a1b2c3d4e5f6");
              assertThat(RequestScopes.requireTenantId()).isEqualTo("tenant_a1b2c3d4e5f6");
            });
  }

  @Test
  void tenantIdUnboundOutsideScope() {
    assertThat(RequestScopes.TENANT_ID.isBound()).isFalse();
    assertThatThrownBy(() -> RequestScopes.TENANT_ID.get())
        .isInstanceOf(NoSuchElementException.class);
    assertThat(RequestScopes.getTenantIdOrNull()).isNull();
  }

  @Test
  void nestedScopeShadowsOuter() {
    RequestScopes.where(RequestScopes.TENANT_ID, "outer")
        .run(
            () -> {
              RequestScopes.where(RequestScopes.TENANT_ID, "inner")
                  .run(() -> assertThat(RequestScopes.TENANT_ID.get()).isEqualTo("inner"));

              assertThat(RequestScopes.TENANT_ID.get()).isEqualTo("outer");
            });
    assertThat(RequestScopes.TENANT_ID.isBound()).isFalse();
  }

  @Test
  void bindingsAreRemovedWhenActionThrows() {
    assertThatThrownBy(
            () ->
                RequestScopes.where(RequestScopes.TENANT_ID, "test")
                    .where(RequestScopes.MEMBER_ID, "user_1")
                    .run(
                        () -> {
                          throw new RuntimeException("test");
                        }))
        .isInstanceOf(RuntimeException.class);
    assertThat(RequestScopes.TENANT_ID.isBound()).isFalse();
    assertThat(RequestScopes.MEMBER_ID.isBound()).isFalse();
  }

  @Test
  void callReturnsValue() throws Exception {
    UUID customer = UUID.randomUUID();

    UUID seen =
        RequestScopes.where(RequestScopes.CUSTOMER_ID, customer)
            .call(RequestScopes::requireCustomerId);

    assertThat(seen).isEqualTo(customer);
  }

  @Test
  void missingCustomerIsForbidden() {
    assertThatThrownBy(RequestScopes::requireCustomerId).isInstanceOf(ForbiddenException.class);
  }
}
