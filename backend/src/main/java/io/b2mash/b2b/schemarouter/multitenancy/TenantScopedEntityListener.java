package io.b2mash.b2b.schemarouter.multitenancy;

import io.b2mash.b2b.schemarouter.exception.NoActiveSchemaException;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;
import java.util.Locale;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * JPA entity listener for tenant-scoped entities. Hibernate sessions opened with nothing bound run
 * against the shared schema, so any tenant entity touched there is rejected with {@link
 * NoActiveSchemaException} instead of being read from or written to the shared schema.
 */
@Component
public class TenantScopedEntityListener {

  private final String sharedSchema;

  public TenantScopedEntityListener(
      @Value("${tenancy.public-schema-name:public}") String sharedSchema) {
    this.sharedSchema = sharedSchema;
  }

  @PrePersist
  @PreUpdate
  @PreRemove
  @PostLoad
  public void requireTenantSchema(Object entity) {
    Optional<String> active = SchemaContext.current();
    if (active.isEmpty() || active.get().equals(sharedSchema)) {
      throw new NoActiveSchemaException(entity.getClass().getSimpleName().toLowerCase(Locale.ROOT));
    }
  }
}
