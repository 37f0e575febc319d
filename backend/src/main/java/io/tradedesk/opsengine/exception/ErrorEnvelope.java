package io.tradedesk.opsengine.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatusCode;

/**
 * Failure body shared by every endpoint: {@code ok} is always false, {@code error} is a stable
 * machine code and {@code message} an optional caller-safe explanation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(boolean ok, String error, String message) {

  public static ErrorEnvelope of(HttpStatusCode status, String message) {
    return new ErrorEnvelope(false, codeFor(status), message);
  }

  static String codeFor(HttpStatusCode status) {
    return switch (status.value()) {
      case 400 -> "bad_request";
      case 401 -> "unauthenticated";
      case 403 -> "forbidden";
      case 404 -> "not_found";
      case 503 -> "service_unavailable";
      default -> "load_failed";
    };
  }
}
