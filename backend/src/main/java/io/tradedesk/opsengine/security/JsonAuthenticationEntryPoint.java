package io.tradedesk.opsengine.security;

import io.tradedesk.opsengine.exception.ErrorEnvelopeWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * {@link AuthenticationEntryPoint} that logs a structured authentication failure warning and
 * answers with the standard {@code {ok:false}} envelope instead of an empty 401.
 *
 * <p>Auth failures happen before tenant context is bound, so nothing else is recorded.
 */
@Component
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(JsonAuthenticationEntryPoint.class);

  private final ErrorEnvelopeWriter envelopeWriter;

  public JsonAuthenticationEntryPoint(ErrorEnvelopeWriter envelopeWriter) {
    this.envelopeWriter = envelopeWriter;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        request.getRemoteAddr());

    response.setHeader("WWW-Authenticate", "Bearer");
    envelopeWriter.write(response, HttpStatus.UNAUTHORIZED, null);
  }
}
