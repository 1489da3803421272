package io.b2mash.b2b.schemarouter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SchemaNotFoundException extends ErrorResponseException {

  private final String schemaName;

  public SchemaNotFoundException(String schemaName) {
    super(HttpStatus.NOT_FOUND, createProblem(schemaName), null);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }

  @Override
  public String getMessage() {
    return "Schema is not provisioned or not active: " + schemaName;
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Schema not found");
    problem.setDetail("Schema " + schemaName + " does not belong to an active tenant");
    return problem;
  }
}
