package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class DuplicateTenantException extends ErrorResponseException {

  public DuplicateTenantException(String identifier, String schemaName) {
    super(HttpStatus.CONFLICT, createProblem(identifier, schemaName), null);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String identifier, String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Tenant already registered");
    problem.setDetail(
        "Identifier '"
            + identifier
            + "' or schema '"
            + schemaName
            + "' is already in use by a live tenant");
    return problem;
  }
}
