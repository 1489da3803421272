package io.b2mash.b2b.schemarouter.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps the infrastructure exceptions onto problem responses. Exceptions extending {@code
 * ErrorResponseException} are rendered by the base class from their own {@link ProblemDetail}.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MigrationConflictException.class)
  public ResponseEntity<ProblemDetail> handleMigrationConflict(MigrationConflictException ex) {
    log.warn("Migration conflict: {}", ex.getMessage());
    return problem(HttpStatus.CONFLICT, "Migration conflict", ex.getMessage());
  }

  @ExceptionHandler(SchemaProvisioningException.class)
  public ResponseEntity<ProblemDetail> handleProvisioningFailure(SchemaProvisioningException ex) {
    log.error("Schema provisioning failed: {}", ex.getMessage(), ex);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Schema provisioning failed", ex.getMessage());
  }

  @ExceptionHandler(MigrationFailedException.class)
  public ResponseEntity<ProblemDetail> handleMigrationFailure(MigrationFailedException ex) {
    log.error("Migration failed: {}", ex.getMessage(), ex);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Migration failed", ex.getMessage());
  }

  @ExceptionHandler(ConnectionLeakDetectedException.class)
  public ResponseEntity<ProblemDetail> handleConnectionLeak(
      ConnectionLeakDetectedException ex, HttpServletRequest request) {
    log.error(
        "CRITICAL: schema binding leak on path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "Connection state error",
        "The connection could not be returned to a clean state");
  }

  @ExceptionHandler(TenancyConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleConfiguration(TenancyConfigurationException ex) {
    log.error("Tenancy configuration error: {}", ex.getMessage());
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR, "Tenancy configuration error", ex.getMessage());
  }

  private static ResponseEntity<ProblemDetail> problem(
      HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return ResponseEntity.status(status).body(problem);
  }
}
