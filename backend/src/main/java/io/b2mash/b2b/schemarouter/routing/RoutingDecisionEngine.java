package io.b2mash.b2b.schemarouter.routing;

import io.b2mash.b2b.schemarouter.config.TenancyProperties;
import io.b2mash.b2b.schemarouter.exception.NoActiveSchemaException;
import io.b2mash.b2b.schemarouter.exception.TenancyConfigurationException;
import io.b2mash.b2b.schemarouter.multitenancy.SchemaContext;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decides which schema an entity's statements run against. Shared entities always go to the
 * shared schema; tenant entities go to the active schema and fail closed when none is active.
 */
@Service
public class RoutingDecisionEngine {

  private static final Logger log = LoggerFactory.getLogger(RoutingDecisionEngine.class);

  private final EntityClassification classification;
  private final String sharedSchema;

  /** Fails startup unless the tenant model itself is classified as shared. */
  @Autowired
  public RoutingDecisionEngine(EntityClassification classification, TenancyProperties properties) {
    this(classification, properties.publicSchemaName());
    if (classify(properties.tenantModel()) != EntityScope.SHARED) {
      throw new TenancyConfigurationException(
          "Tenant model " + properties.tenantModel() + " must belong to a shared app");
    }
    log.info(
        "Classified {} entity types; shared schema is {}",
        classification.entityTypes().size(),
        sharedSchema);
  }

  public RoutingDecisionEngine(EntityClassification classification, String sharedSchema) {
    this.classification = classification;
    this.sharedSchema = sharedSchema;
  }

  public EntityScope classify(String entityType) {
    EntityScope scope = classification.scopeOf(entityType);
    if (scope == null) {
      throw new TenancyConfigurationException("Entity type not classified: " + entityType);
    }
    return scope;
  }

  public String resolveSchemaFor(String entityType, Optional<String> activeSchema) {
    if (classify(entityType) == EntityScope.SHARED) {
      return sharedSchema;
    }
    return activeSchema.orElseThrow(() -> new NoActiveSchemaException(entityType));
  }

  /** Resolves against the calling unit of work's {@link SchemaContext}. */
  public String resolveSchemaFor(String entityType) {
    return resolveSchemaFor(entityType, SchemaContext.current());
  }

  public String sharedSchema() {
    return sharedSchema;
  }
}
