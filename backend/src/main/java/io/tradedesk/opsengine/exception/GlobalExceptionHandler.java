package io.tradedesk.opsengine.exception;

import io.tradedesk.opsengine.multitenancy.MemberContextNotBoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders every failure as an {@link ErrorEnvelope}. Client errors are logged at WARN; server
 * errors at ERROR with the stack trace kept server-side.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ErrorEnvelope> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    return respond(HttpStatus.FORBIDDEN, "Insufficient permissions for this operation");
  }

  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ErrorEnvelope> handleErrorResponse(
      ErrorResponseException ex, HttpServletRequest request) {
    String detail = ex.getBody().getDetail();
    if (ex.getStatusCode().is5xxServerError()) {
      log.error(
          "Request failed: path={}, status={}, reason={}",
          request.getRequestURI(),
          ex.getStatusCode().value(),
          detail);
    } else {
      log.warn(
          "Request rejected: path={}, method={}, status={}, reason={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getStatusCode().value(),
          detail);
    }
    return ResponseEntity.status(ex.getStatusCode())
        .body(ErrorEnvelope.of(ex.getStatusCode(), detail));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorEnvelope> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
    log.warn("Malformed parameter: path={}, parameter={}", request.getRequestURI(), ex.getName());
    return respond(HttpStatus.BAD_REQUEST, "Parameter '%s' is malformed".formatted(ex.getName()));
  }

  @ExceptionHandler(DataAccessResourceFailureException.class)
  public ResponseEntity<ErrorEnvelope> handleStoreUnavailable(
      DataAccessResourceFailureException ex, HttpServletRequest request) {
    log.error("Data store unavailable: path={}", request.getRequestURI(), ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "Data is temporarily unavailable");
  }

  @ExceptionHandler(MemberContextNotBoundException.class)
  public ResponseEntity<ErrorEnvelope> handleMemberContextNotBound(
      MemberContextNotBoundException ex) {
    log.error("Member context invariant violation: {}", ex.getMessage());
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorEnvelope> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    log.error("Unhandled failure: path={}", request.getRequestURI(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, null);
  }

  private ResponseEntity<ErrorEnvelope> respond(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(ErrorEnvelope.of(status, message));
  }
}
