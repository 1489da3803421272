package io.b2mash.b2b.schemarouter.multitenancy;

import org.hibernate.context.spi.CurrentTenantIdentifierResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Hibernate's tenant identifier is the active schema, or the shared schema when none is bound.
 * Sessions on the shared schema only reach shared entities; {@link TenantScopedEntityListener}
 * rejects tenant entities there.
 */
@Component
public class SchemaIdentifierResolver implements CurrentTenantIdentifierResolver<String> {

  private final String sharedSchema;

  public SchemaIdentifierResolver(
      @Value("${tenancy.public-schema-name:public}") String sharedSchema) {
    this.sharedSchema = sharedSchema;
  }

  @Override
  public String resolveCurrentTenantIdentifier() {
    return SchemaContext.current().orElse(sharedSchema);
  }

  @Override
  public boolean validateExistingCurrentSessions() {
    return true;
  }

  @Override
  public boolean isRoot(String tenantId) {
    return sharedSchema.equals(tenantId);
  }
}
