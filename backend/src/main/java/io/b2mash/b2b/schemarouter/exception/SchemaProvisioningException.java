package io.b2mash.b2b.schemarouter.exception;

public class SchemaProvisioningException extends RuntimeException {

  private final String identifier;
  private final String schemaName;

  public SchemaProvisioningException(String identifier, String schemaName, Throwable cause) {
    super("Provisioning failed for tenant " + identifier + " (schema " + schemaName + ")", cause);
    this.identifier = identifier;
    this.schemaName = schemaName;
  }

  public SchemaProvisioningException(String identifier, String schemaName, String reason) {
    super(
        "Provisioning failed for tenant " + identifier + " (schema " + schemaName + "): " + reason);
    this.identifier = identifier;
    this.schemaName = schemaName;
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getSchemaName() {
    return schemaName;
  }
}
