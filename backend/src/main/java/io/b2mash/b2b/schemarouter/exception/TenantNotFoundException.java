package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotFoundException extends ErrorResponseException {

  private final String identifier;

  public TenantNotFoundException(String identifier) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem("Tenant not found", "No active tenant found with identifier " + identifier),
        null);
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }

  @Override
  public String getMessage() {
    return "Tenant not found: " + identifier;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
