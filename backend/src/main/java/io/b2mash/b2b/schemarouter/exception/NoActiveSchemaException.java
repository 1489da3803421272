package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Tenant-scoped data was requested while no schema is active. Never recovered by falling back to
 * the shared schema.
 */
public class NoActiveSchemaException extends ErrorResponseException {

  public NoActiveSchemaException(String entityType) {
    super(HttpStatus.BAD_REQUEST, createProblem(entityType), null);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String entityType) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing tenant context");
    problem.setDetail("Entity '" + entityType + "' is tenant-scoped but no schema is active");
    return problem;
  }
}
