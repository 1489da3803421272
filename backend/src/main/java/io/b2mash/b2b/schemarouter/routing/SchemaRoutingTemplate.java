package io.b2mash.b2b.schemarouter.routing;

import io.b2mash.b2b.schemarouter.multitenancy.ConnectionSchemaBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.stereotype.Component;

/**
 * Entry point for data access by entity type: routes to the right schema, then runs the callback
 * on a connection bound to it.
 */
@Component
public class SchemaRoutingTemplate {

  private static final Logger log = LoggerFactory.getLogger(SchemaRoutingTemplate.class);

  private final RoutingDecisionEngine routing;
  private final ConnectionSchemaBinder binder;

  public SchemaRoutingTemplate(
      RoutingDecisionEngine routing, @Qualifier("appSchemaBinder") ConnectionSchemaBinder binder) {
    this.routing = routing;
    this.binder = binder;
  }

  public <T> T execute(String entityType, ConnectionCallback<T> callback) {
    String schema = routing.resolveSchemaFor(entityType);
    log.debug("Routing {} to schema {}", entityType, schema);
    return binder.withSchema(schema, callback);
  }
}
