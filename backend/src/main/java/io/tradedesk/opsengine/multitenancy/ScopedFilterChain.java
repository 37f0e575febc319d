package io.tradedesk.opsengine.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Bridges {@link ScopeCarrier}'s callable API with the servlet FilterChain's checked exceptions
 * (IOException, ServletException).
 */
public final class ScopedFilterChain {

  private ScopedFilterChain() {}

  /**
   * Runs {@code chain.doFilter} inside the carrier's bindings. Checked exceptions from the chain
   * propagate unchanged; unchecked ones propagate as-is and the bindings are removed on any exit
   * path.
   */
  public static void runScoped(
      ScopeCarrier carrier,
      FilterChain chain,
      HttpServletRequest request,
      HttpServletResponse response)
      throws ServletException, IOException {
    try {
      carrier.call(
          () -> {
            chain.doFilter(request, response);
            return null;
          });
    } catch (IOException | ServletException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ServletException(e);
    }
  }
}
