package io.b2mash.b2b.schemarouter.exception;

/**
 * A pooled connection could not be returned to its prior schema. The connection has already been
 * evicted when this is thrown.
 */
public class ConnectionLeakDetectedException extends RuntimeException {

  private final String boundSchema;

  public ConnectionLeakDetectedException(String boundSchema, Throwable cause) {
    super("Connection bound to schema " + boundSchema + " could not be restored", cause);
    this.boundSchema = boundSchema;
  }

  public String getBoundSchema() {
    return boundSchema;
  }
}
