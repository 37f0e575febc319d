package io.tradedesk.opsengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ServiceUnavailableException extends ErrorResponseException {

  public ServiceUnavailableException(String title, String detail) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
