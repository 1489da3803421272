package io.b2mash.b2b.schemarouter.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.schemarouter.exception.DuplicateTenantException;
import io.b2mash.b2b.schemarouter.exception.InvalidTenantStateException;
import io.b2mash.b2b.schemarouter.exception.SchemaNotFoundException;
import io.b2mash.b2b.schemarouter.exception.SchemaProvisioningException;
import io.b2mash.b2b.schemarouter.exception.TenantNotFoundException;
import io.b2mash.b2b.schemarouter.migration.Migration;
import io.b2mash.b2b.schemarouter.migration.MigrationCategory;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import io.b2mash.b2b.schemarouter.migration.MigrationStateTracker;
import io.b2mash.b2b.schemarouter.migration.SqlMigrationLoader;
import io.b2mash.b2b.schemarouter.multitenancy.ConnectionSchemaBinder;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRecord;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import io.b2mash.b2b.schemarouter.multitenancy.TenantStatus;
import io.b2mash.b2b.schemarouter.testutil.H2TestDatabase;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaLifecycleManagerTest {

  private H2TestDatabase db;
  private TenantRegistry registry;
  private MigrationStateTracker tracker;
  private MigrationGraph tenantGraph;
  private SchemaLifecycleManager manager;

  @BeforeEach
  void setUp() {
    db = H2TestDatabase.create();
    registry = db.registry();
    tracker =
        new MigrationStateTracker(
            ConnectionSchemaBinder.forMigrations(db.migrationDataSource(), H2TestDatabase.SHARED),
            2,
            H2TestDatabase.clock());
    tenantGraph =
        new SqlMigrationLoader().load(MigrationCategory.TENANT, "classpath:db/migration/tenant");
    manager = new SchemaLifecycleManager(registry, tracker, tenantGraph, db.jdbc());
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  private SchemaLifecycleManager managerWith(MigrationGraph graph) {
    return new SchemaLifecycleManager(registry, tracker, graph, db.jdbc());
  }

  @Test
  void onboard_createsSchemaAppliesTenantGraphAndActivates() {
    TenantRecord record = manager.onboard("acme", null);

    assertThat(record.status()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(record.schemaName()).isEqualTo("acme");
    assertThat(db.schemaExists("acme")).isTrue();
    assertThat(db.ledger("acme")).containsExactly("0001_init", "0002_note");
    assertThat(db.tableExists("acme", "customer")).isTrue();
    assertThat(db.tableExists(H2TestDatabase.SHARED, "customer")).isFalse();
    assertThat(registry.lookup("acme")).isEqualTo("acme");
  }

  @Test
  void onboard_usesExplicitSchemaName() {
    TenantRecord record = manager.onboard("Acme Corporation", "acme_corp");

    assertThat(record.schemaName()).isEqualTo("acme_corp");
    assertThat(db.schemaExists("acme_corp")).isTrue();
  }

  @Test
  void onboard_duplicateIdentifierLeavesExistingTenantUntouched() {
    manager.onboard("acme", null);

    assertThatThrownBy(() -> manager.onboard("acme", "acme_two"))
        .isInstanceOf(DuplicateTenantException.class);
    assertThat(db.schemaExists("acme_two")).isFalse();
    assertThat(registry.lookup("acme")).isEqualTo("acme");
  }

  @Test
  void tenantDataIsIsolatedBetweenSchemas() {
    manager.onboard("acme", null);
    manager.onboard("beta", null);
    var appBinder = ConnectionSchemaBinder.forTenants(db.appDataSource(), registry);

    appBinder.withSchema(
        "acme", conn -> update(conn, "INSERT INTO customer (name) VALUES ('Acme Customer')"));

    assertThat(countCustomers(appBinder, "acme")).isEqualTo(1);
    assertThat(countCustomers(appBinder, "beta")).isZero();
  }

  @Test
  void provision_isANoOpForActiveTenant() {
    TenantRecord first = manager.onboard("acme", null);

    TenantRecord again = manager.provision("acme");

    assertThat(again).isEqualTo(first);
    assertThat(db.ledger("acme")).containsExactly("0001_init", "0002_note");
  }

  @Test
  void provision_unknownTenantThrowsTenantNotFound() {
    assertThatThrownBy(() -> manager.provision("ghost"))
        .isInstanceOf(TenantNotFoundException.class);
  }

  @Test
  void provision_failedMigrationDropsSchemaAndKeepsTenantProvisioning() {
    var failing =
        MigrationGraph.of(
            MigrationCategory.TENANT,
            List.of(
                Migration.of("0001_ok", conn -> update(conn, "CREATE TABLE t (id INT)")),
                Migration.of(
                    "0002_broken", conn -> update(conn, "SELECT * FROM missing"), "0001_ok")));
    registry.register("acme");

    assertThatThrownBy(() -> managerWith(failing).provision("acme"))
        .isInstanceOf(SchemaProvisioningException.class)
        .hasMessageContaining("acme");

    assertThat(db.schemaExists("acme")).isFalse();
    assertThat(registry.require("acme").status()).isEqualTo(TenantStatus.PROVISIONING);
    assertThatThrownBy(() -> registry.lookup("acme")).isInstanceOf(TenantNotFoundException.class);

    // A retry with a working graph completes provisioning
    TenantRecord retried = manager.provision("acme");
    assertThat(retried.status()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(db.ledger("acme")).containsExactly("0001_init", "0002_note");
  }

  @Test
  void provision_refusesRetainedSchemaOfDecommissionedTenant() {
    manager.onboard("acme", "acme");
    var appBinder = ConnectionSchemaBinder.forTenants(db.appDataSource(), registry);
    appBinder.withSchema(
        "acme", conn -> update(conn, "INSERT INTO customer (name) VALUES ('Acme Customer')"));
    manager.decommission("acme");
    registry.register("intruder", "acme");

    assertThatThrownBy(() -> manager.provision("intruder"))
        .isInstanceOf(SchemaProvisioningException.class)
        .hasMessageContaining("holds data");

    assertThat(registry.require("intruder").status()).isEqualTo(TenantStatus.PROVISIONING);
    assertThatThrownBy(() -> appBinder.withSchema("acme", conn -> null))
        .isInstanceOf(SchemaNotFoundException.class);
    assertThat(db.schemaExists("acme")).isTrue();
    Integer retained =
        db.jdbc().sql("SELECT COUNT(*) FROM acme.customer").query(Integer.class).single();
    assertThat(retained).isEqualTo(1);
  }

  @Test
  void provision_adoptsExistingEmptySchema() {
    db.createSchema("acme");
    registry.register("acme");

    TenantRecord record = manager.provision("acme");

    assertThat(record.status()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(db.ledger("acme")).containsExactly("0001_init", "0002_note");
  }

  @Test
  void provision_failureKeepsSchemaItDidNotCreate() {
    db.createSchema("acme");
    registry.register("acme");
    var failing =
        MigrationGraph.of(
            MigrationCategory.TENANT,
            List.of(Migration.of("0001_broken", conn -> update(conn, "SELECT * FROM missing"))));

    assertThatThrownBy(() -> managerWith(failing).provision("acme"))
        .isInstanceOf(SchemaProvisioningException.class);

    assertThat(db.schemaExists("acme")).isTrue();
    assertThat(registry.require("acme").status()).isEqualTo(TenantStatus.PROVISIONING);

    // Only the ledger was left behind, so a retry adopts the schema again
    assertThat(manager.provision("acme").status()).isEqualTo(TenantStatus.ACTIVE);
  }

  @Test
  void provision_refusesSuspendedTenant() {
    manager.onboard("acme", null);
    registry.markSuspended("acme");

    assertThatThrownBy(() -> manager.provision("acme"))
        .isInstanceOf(InvalidTenantStateException.class);
  }

  @Test
  void decommission_keepsSchemaUntilExplicitDrop() {
    manager.onboard("acme", null);

    TenantRecord dropped = manager.decommission("acme");

    assertThat(dropped.status()).isEqualTo(TenantStatus.DROPPED);
    assertThat(db.schemaExists("acme")).isTrue();
    assertThatThrownBy(() -> registry.lookup("acme")).isInstanceOf(TenantNotFoundException.class);
  }

  @Test
  void dropSchema_requiresDecommissionAndMatchingConfirmation() {
    manager.onboard("acme", null);

    assertThatThrownBy(() -> manager.dropSchema("acme", "acme"))
        .isInstanceOf(InvalidTenantStateException.class);

    manager.decommission("acme");

    assertThatThrownBy(() -> manager.dropSchema("acme", "wrong"))
        .isInstanceOf(InvalidTenantStateException.class);
    assertThat(db.schemaExists("acme")).isTrue();

    manager.dropSchema("acme", "acme");
    assertThat(db.schemaExists("acme")).isFalse();
  }

  @Test
  void dropSchema_refusedWhileAnotherLiveTenantHoldsTheSchemaName() {
    manager.onboard("acme", null);
    manager.decommission("acme");
    registry.register("acme-reborn", "acme");

    assertThatThrownBy(() -> manager.dropSchema("acme", "acme"))
        .isInstanceOf(InvalidTenantStateException.class)
        .hasMessageContaining("another live tenant");
    assertThat(db.schemaExists("acme")).isTrue();
  }

  @Test
  void migrate_appliesNewTenantMigrationsToOneTenant() {
    manager.onboard("acme", null);
    var extended =
        MigrationGraph.of(
            MigrationCategory.TENANT,
            List.of(
                tenantGraph.get("0001_init"),
                tenantGraph.get("0002_note"),
                Migration.of(
                    "0003_tag",
                    conn -> update(conn, "CREATE TABLE tag (id INT PRIMARY KEY)"),
                    "0002_note")));

    List<String> applied = managerWith(extended).migrate("acme");

    assertThat(applied).containsExactly("0003_tag");
    assertThat(db.tableExists("acme", "tag")).isTrue();
  }

  @Test
  void migrate_refusesTenantStillProvisioning() {
    registry.register("acme");

    assertThatThrownBy(() -> manager.migrate("acme"))
        .isInstanceOf(InvalidTenantStateException.class);
  }

  @Test
  void migrateAll_coversEveryActiveTenant() {
    manager.onboard("acme", null);
    manager.onboard("beta", null);
    registry.register("gamma");

    var report = manager.migrateAll();

    assertThat(report.outcomes())
        .extracting(o -> o.schemaName())
        .containsExactly("acme", "beta");
    assertThat(report.hasFailures()).isFalse();
  }

  @Test
  void migrateShared_appliesSharedGraphToSharedSchema() {
    var sharedGraph =
        new SqlMigrationLoader().load(MigrationCategory.SHARED, "classpath:db/migration/shared");

    List<String> applied = manager.migrateShared(sharedGraph);

    assertThat(applied).containsExactly("0001_init");
    assertThat(db.tableExists(H2TestDatabase.SHARED, "plan")).isTrue();
    assertThat(manager.migrateShared(sharedGraph)).isEmpty();
  }

  @Test
  void listProvisioned_pagesThroughAllActiveTenants() {
    for (String id : List.of("e", "a", "d", "b", "c")) {
      registry.register("tenant_" + id);
      registry.markActive("tenant_" + id);
    }
    registry.register("tenant_z");

    var iterator = new SchemaLifecycleManager.ActiveTenantIterator(registry, 2);
    List<String> seen = new ArrayList<>();
    iterator.forEachRemaining(r -> seen.add(r.identifier()));

    assertThat(seen).containsExactly("tenant_a", "tenant_b", "tenant_c", "tenant_d", "tenant_e");
  }

  @Test
  void listProvisioned_isRestartable() {
    manager.onboard("acme", null);
    Iterable<TenantRecord> provisioned = manager.listProvisioned();

    List<String> first = new ArrayList<>();
    List<String> second = new ArrayList<>();
    provisioned.forEach(r -> first.add(r.identifier()));
    provisioned.forEach(r -> second.add(r.identifier()));

    assertThat(first).containsExactly("acme");
    assertThat(second).isEqualTo(first);
  }

  private static Void update(Connection conn, String sql) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
    return null;
  }

  private static int countCustomers(ConnectionSchemaBinder binder, String schema) {
    Integer count =
        binder.withSchema(
            schema,
            conn -> {
              try (var stmt = conn.createStatement();
                  var rs = stmt.executeQuery("SELECT COUNT(*) FROM customer")) {
                rs.next();
                return rs.getInt(1);
              }
            });
    return count;
  }
}
