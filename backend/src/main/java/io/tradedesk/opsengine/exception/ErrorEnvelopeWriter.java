package io.tradedesk.opsengine.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/** Writes {@link ErrorEnvelope} bodies from filters, outside Spring MVC's exception handling. */
@Component
public class ErrorEnvelopeWriter {

  private final ObjectMapper objectMapper;

  public ErrorEnvelopeWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void write(HttpServletResponse response, HttpStatus status, String message)
      throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(), ErrorEnvelope.of(status, message));
  }
}
