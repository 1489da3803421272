package io.b2mash.b2b.schemarouter.exception;

import java.util.List;

public class MigrationFailedException extends RuntimeException {

  private final String schemaName;
  private final String migrationId;
  private final List<String> appliedBeforeFailure;

  public MigrationFailedException(String schemaName, String migrationId, Throwable cause) {
    this(schemaName, migrationId, cause, List.of());
  }

  /**
   * @param appliedBeforeFailure migrations committed to the schema earlier in the same run; they
   *     stay applied
   */
  public MigrationFailedException(
      String schemaName, String migrationId, Throwable cause, List<String> appliedBeforeFailure) {
    super("Migration " + migrationId + " failed on schema " + schemaName, cause);
    this.schemaName = schemaName;
    this.migrationId = migrationId;
    this.appliedBeforeFailure = List.copyOf(appliedBeforeFailure);
  }

  public String getSchemaName() {
    return schemaName;
  }

  public String getMigrationId() {
    return migrationId;
  }

  public List<String> getAppliedBeforeFailure() {
    return appliedBeforeFailure;
  }
}
