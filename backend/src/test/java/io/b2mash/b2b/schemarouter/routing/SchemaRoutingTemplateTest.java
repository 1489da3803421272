package io.b2mash.b2b.schemarouter.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.schemarouter.exception.NoActiveSchemaException;
import io.b2mash.b2b.schemarouter.multitenancy.ConnectionSchemaBinder;
import io.b2mash.b2b.schemarouter.multitenancy.SchemaContext;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import io.b2mash.b2b.schemarouter.testutil.H2TestDatabase;
import java.sql.Connection;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaRoutingTemplateTest {

  private H2TestDatabase db;
  private SchemaRoutingTemplate template;

  @BeforeEach
  void setUp() {
    db = H2TestDatabase.create();
    TenantRegistry registry = db.registry();
    registry.register("acme");
    db.createSchema("acme");
    registry.markActive("acme");
    var engine =
        new RoutingDecisionEngine(
            EntityClassification.fromApps(
                Map.of("plan", "billing", "customer", "crm"),
                List.of("billing"),
                List.of("crm")),
            H2TestDatabase.SHARED);
    template =
        new SchemaRoutingTemplate(
            engine, ConnectionSchemaBinder.forTenants(db.appDataSource(), registry));
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  @Test
  void tenantEntityRunsOnActiveTenantSchema() {
    SchemaContext.runInSchema(
        "acme",
        () -> {
          String schema = template.execute("customer", Connection::getSchema);
          assertThat(schema).isEqualTo("acme");
        });
  }

  @Test
  void sharedEntityRunsOnSharedSchemaEvenInsideTenantContext() {
    SchemaContext.runInSchema(
        "acme",
        () -> {
          String schema = template.execute("plan", Connection::getSchema);
          assertThat(schema).isEqualTo(H2TestDatabase.SHARED);
        });
  }

  @Test
  void tenantEntityOutsideTenantContextIsRejected() {
    assertThatThrownBy(() -> template.execute("customer", Connection::getSchema))
        .isInstanceOf(NoActiveSchemaException.class);
  }
}
