package io.b2mash.b2b.schemarouter.provisioning;

import io.b2mash.b2b.schemarouter.exception.InvalidTenantStateException;
import io.b2mash.b2b.schemarouter.exception.SchemaProvisioningException;
import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import io.b2mash.b2b.schemarouter.migration.MigrationLedger;
import io.b2mash.b2b.schemarouter.migration.MigrationStateTracker;
import io.b2mash.b2b.schemarouter.multitenancy.SchemaNames;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRecord;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import io.b2mash.b2b.schemarouter.multitenancy.TenantStatus;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Service;

/**
 * Creates and retires tenant schemas. Provisioning is all-or-nothing from the caller's view: a
 * tenant only becomes ACTIVE once its schema exists and carries the full tenant migration graph.
 */
@Service
public class SchemaLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(SchemaLifecycleManager.class);

  static final int PAGE_SIZE = 100;

  private final TenantRegistry registry;
  private final MigrationStateTracker tracker;
  private final MigrationGraph tenantGraph;
  private final JdbcClient migrationJdbc;

  public SchemaLifecycleManager(
      TenantRegistry registry,
      MigrationStateTracker tracker,
      @Qualifier("tenantMigrationGraph") MigrationGraph tenantGraph,
      @Qualifier("migrationJdbcClient") JdbcClient migrationJdbc) {
    this.registry = registry;
    this.tracker = tracker;
    this.tenantGraph = tenantGraph;
    this.migrationJdbc = migrationJdbc;
  }

  /** Registers a tenant and provisions its schema in one step. */
  public TenantRecord onboard(String identifier, String schemaName) {
    if (schemaName == null || schemaName.isBlank()) {
      registry.register(identifier);
    } else {
      registry.register(identifier, schemaName);
    }
    return provision(identifier);
  }

  /**
   * Creates the tenant's schema, applies the tenant graph and activates the tenant. Already ACTIVE
   * tenants are returned unchanged. When migrations fail the schema is dropped again, but only if
   * this call created it, and the record stays PROVISIONING so the call can simply be retried.
   *
   * <p>A schema that already exists is adopted only while it holds no tables besides the migration
   * ledger. One with tables, such as a schema retained after a decommission, is refused and left
   * untouched.
   */
  public TenantRecord provision(String identifier) {
    TenantRecord record = registry.require(identifier);
    if (record.status() == TenantStatus.ACTIVE) {
      log.info("Tenant {} already provisioned in schema {}", identifier, record.schemaName());
      return record;
    }
    if (record.status() != TenantStatus.PROVISIONING) {
      throw new InvalidTenantStateException(
          identifier, "cannot provision a tenant in status " + record.status());
    }

    String schemaName = record.schemaName();
    log.info("Provisioning schema {} for tenant {}", schemaName, identifier);
    boolean created = createTenantSchema(identifier, schemaName);

    try {
      List<String> applied = tracker.apply(schemaName, tenantGraph);
      log.info("Applied {} tenant migrations to schema {}", applied.size(), schemaName);
    } catch (RuntimeException e) {
      if (created) {
        log.error("Migrations failed on new schema {}; dropping it", schemaName, e);
        dropSchemaAfterFailure(schemaName, e);
      } else {
        log.error("Migrations failed on adopted schema {}; leaving it in place", schemaName, e);
      }
      throw new SchemaProvisioningException(identifier, schemaName, e);
    }

    TenantRecord active = registry.markActive(identifier);
    log.info("Successfully provisioned tenant {} in schema {}", identifier, schemaName);
    return active;
  }

  /**
   * Marks the tenant DROPPED. Its schema and data are left in place until {@link #dropSchema} is
   * called explicitly.
   */
  public TenantRecord decommission(String identifier) {
    TenantRecord dropped = registry.markDropped(identifier);
    log.info(
        "Decommissioned tenant {}; schema {} retained until explicitly dropped",
        identifier,
        dropped.schemaName());
    return dropped;
  }

  /**
   * Physically removes a decommissioned tenant's schema. {@code confirmation} must repeat the
   * schema name. Refused while any live tenant uses that schema name.
   */
  public void dropSchema(String identifier, String confirmation) {
    if (registry.find(identifier).isPresent()) {
      throw new InvalidTenantStateException(
          identifier, "decommission the tenant before dropping its schema");
    }
    TenantRecord dropped =
        registry.history(identifier).stream()
            .filter(r -> r.status() == TenantStatus.DROPPED)
            .max(Comparator.comparing(TenantRecord::updatedAt))
            .orElseThrow(
                () ->
                    new InvalidTenantStateException(
                        identifier, "no decommissioned record with a schema to drop"));
    String schemaName = dropped.schemaName();
    if (!schemaName.equals(confirmation)) {
      throw new InvalidTenantStateException(
          identifier, "confirmation does not match schema name " + schemaName);
    }
    if (registry.isSchemaInUse(schemaName)) {
      throw new InvalidTenantStateException(
          identifier, "schema " + schemaName + " is held by another live tenant");
    }
    dropSchemaCascade(schemaName);
    log.warn("Dropped schema {} of decommissioned tenant {}", schemaName, identifier);
  }

  /** Creates the shared schema if needed and applies the shared graph to it. */
  public List<String> migrateShared(MigrationGraph sharedGraph) {
    String sharedSchema = registry.sharedSchema();
    ensureSchema(sharedSchema);
    List<String> applied = tracker.apply(sharedSchema, sharedGraph);
    log.info("Shared schema {} migrated, {} migrations applied", sharedSchema, applied.size());
    return applied;
  }

  /**
   * Applies pending tenant migrations to one tenant's schema. PROVISIONING tenants have no schema
   * yet and must go through {@link #provision} instead.
   */
  public List<String> migrate(String identifier) {
    TenantRecord record = registry.require(identifier);
    if (record.status() == TenantStatus.PROVISIONING) {
      throw new InvalidTenantStateException(
          identifier, "tenant is still PROVISIONING; provision it first");
    }
    return tracker.apply(record.schemaName(), tenantGraph);
  }

  /** Applies pending tenant migrations to every ACTIVE tenant schema. */
  public BulkMigrationReport migrateAll() {
    List<String> schemas = new ArrayList<>();
    for (TenantRecord record : listProvisioned()) {
      schemas.add(record.schemaName());
    }
    if (schemas.isEmpty()) {
      log.info("No tenant schemas found, skipping per-tenant migrations");
      return new BulkMigrationReport(List.of(), false);
    }
    return tracker.applyAcrossSchemas(schemas, tenantGraph);
  }

  /**
   * ACTIVE tenants, fetched page by page as the iteration advances. Each call to {@code
   * iterator()} starts again from the first tenant.
   */
  public Iterable<TenantRecord> listProvisioned() {
    return () -> new ActiveTenantIterator(registry, PAGE_SIZE);
  }

  /** Returns whether the schema was created by this call; false means an empty one was adopted. */
  private boolean createTenantSchema(String identifier, String schemaName) {
    try {
      if (schemaExists(schemaName)) {
        int tables = tableCount(schemaName);
        if (tables > 0) {
          log.error(
              "Schema {} already exists with {} tables; refusing to hand it to tenant {}",
              schemaName,
              tables,
              identifier);
          throw new SchemaProvisioningException(
              identifier,
              schemaName,
              "schema already exists and holds data; drop it explicitly before reuse");
        }
        log.warn("Adopting existing empty schema {} for tenant {}", schemaName, identifier);
        return false;
      }
      // quote() re-validates the name; quoting keeps reserved words usable as schema names
      migrationJdbc.sql("CREATE SCHEMA " + SchemaNames.quote(schemaName)).update();
      log.debug("Created schema {}", schemaName);
      return true;
    } catch (SchemaProvisioningException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to create schema {} for tenant {}", schemaName, identifier, e);
      throw new SchemaProvisioningException(identifier, schemaName, e);
    }
  }

  private void ensureSchema(String schemaName) {
    migrationJdbc.sql("CREATE SCHEMA IF NOT EXISTS " + SchemaNames.quote(schemaName)).update();
    log.debug("Ensured schema {} exists", schemaName);
  }

  private boolean schemaExists(String schemaName) {
    Integer count =
        migrationJdbc
            .sql("SELECT COUNT(*) FROM information_schema.schemata WHERE schema_name = ?")
            .param(schemaName)
            .query(Integer.class)
            .single();
    return count != null && count > 0;
  }

  private int tableCount(String schemaName) {
    Integer count =
        migrationJdbc
            .sql(
                "SELECT COUNT(*) FROM information_schema.tables"
                    + " WHERE table_schema = ? AND table_name <> ?")
            .params(schemaName, MigrationLedger.TABLE)
            .query(Integer.class)
            .single();
    return count != null ? count : 0;
  }

  private void dropSchemaAfterFailure(String schemaName, RuntimeException cause) {
    try {
      dropSchemaCascade(schemaName);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
      log.error("Could not drop partially provisioned schema {}", schemaName, e);
    }
  }

  private void dropSchemaCascade(String schemaName) {
    migrationJdbc
        .sql("DROP SCHEMA IF EXISTS " + SchemaNames.quote(schemaName) + " CASCADE")
        .update();
  }

  static final class ActiveTenantIterator implements Iterator<TenantRecord> {

    private final TenantRegistry registry;
    private final int pageSize;
    private Iterator<TenantRecord> page = List.<TenantRecord>of().iterator();
    private String lastIdentifier;
    private boolean exhausted;

    ActiveTenantIterator(TenantRegistry registry, int pageSize) {
      this.registry = registry;
      this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      List<TenantRecord> next = registry.activePage(lastIdentifier, pageSize);
      if (next.size() < pageSize) {
        exhausted = true;
      }
      if (next.isEmpty()) {
        return false;
      }
      lastIdentifier = next.get(next.size() - 1).identifier();
      page = next.iterator();
      return true;
    }

    @Override
    public TenantRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.next();
    }
  }
}
