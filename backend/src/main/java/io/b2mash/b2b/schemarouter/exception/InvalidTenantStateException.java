package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidTenantStateException extends ErrorResponseException {

  public InvalidTenantStateException(String identifier, String detail) {
    super(HttpStatus.CONFLICT, createProblem(identifier, detail), null);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String identifier, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid tenant state");
    problem.setDetail("Tenant " + identifier + ": " + detail);
    return problem;
  }
}
