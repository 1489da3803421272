package io.b2mash.b2b.schemarouter.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.schemarouter.exception.NoActiveSchemaException;
import io.b2mash.b2b.schemarouter.exception.TenancyConfigurationException;
import io.b2mash.b2b.schemarouter.multitenancy.SchemaContext;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RoutingDecisionEngineTest {

  private final RoutingDecisionEngine engine =
      new RoutingDecisionEngine(
          EntityClassification.fromApps(
              Map.of("tenant_record", "tenancy", "customer", "crm"),
              List.of("tenancy"),
              List.of("crm")),
          "public");

  @Test
  void sharedEntityAlwaysRoutesToSharedSchema() {
    assertThat(engine.resolveSchemaFor("tenant_record", Optional.empty())).isEqualTo("public");
    assertThat(engine.resolveSchemaFor("tenant_record", Optional.of("acme"))).isEqualTo("public");
  }

  @Test
  void tenantEntityRoutesToActiveSchema() {
    assertThat(engine.resolveSchemaFor("customer", Optional.of("acme"))).isEqualTo("acme");
  }

  @Test
  void tenantEntityWithoutActiveSchemaFailsClosed() {
    assertThatThrownBy(() -> engine.resolveSchemaFor("customer", Optional.empty()))
        .isInstanceOf(NoActiveSchemaException.class);
  }

  @Test
  void unclassifiedEntityIsAConfigurationError() {
    assertThatThrownBy(() -> engine.classify("invoice"))
        .isInstanceOf(TenancyConfigurationException.class);
  }

  @Test
  void resolveSchemaFor_readsSchemaContext() {
    SchemaContext.runInSchema(
        "beta", () -> assertThat(engine.resolveSchemaFor("customer")).isEqualTo("beta"));
    assertThatThrownBy(() -> engine.resolveSchemaFor("customer"))
        .isInstanceOf(NoActiveSchemaException.class);
  }
}
