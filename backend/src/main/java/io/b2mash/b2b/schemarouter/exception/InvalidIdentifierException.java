package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised for schema names or tenant identifiers that are unsafe to store or interpolate. */
public class InvalidIdentifierException extends ErrorResponseException {

  public InvalidIdentifierException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid identifier");
    problem.setDetail(detail);
    return problem;
  }
}
