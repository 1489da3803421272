package io.b2mash.b2b.schemarouter.exception;

/** A migration graph that cannot be ordered against a schema's ledger. */
public class MigrationConflictException extends RuntimeException {

  private final String schemaName;

  public MigrationConflictException(String schemaName, String message) {
    super(schemaName != null ? "[" + schemaName + "] " + message : message);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }
}
