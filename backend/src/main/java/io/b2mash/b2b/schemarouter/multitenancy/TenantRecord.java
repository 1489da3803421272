package io.b2mash.b2b.schemarouter.multitenancy;

import java.time.Instant;

/**
 * Row of the tenant registry. Records are never deleted; DROPPED ones are kept for audit.
 *
 * @param identifier opaque business key supplied by the caller
 * @param schemaName Postgres schema holding the tenant's data
 */
public record TenantRecord(
    String identifier,
    String schemaName,
    TenantStatus status,
    Instant createdAt,
    Instant updatedAt) {

  public static TenantRecord provisioning(String identifier, String schemaName, Instant now) {
    return new TenantRecord(identifier, schemaName, TenantStatus.PROVISIONING, now, now);
  }

  public boolean isActive() {
    return status == TenantStatus.ACTIVE;
  }

  public TenantRecord withStatus(TenantStatus newStatus, Instant now) {
    return new TenantRecord(identifier, schemaName, newStatus, createdAt, now);
  }
}
