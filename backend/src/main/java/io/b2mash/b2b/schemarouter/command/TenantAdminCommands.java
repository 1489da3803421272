package io.b2mash.b2b.schemarouter.command;

import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import io.b2mash.b2b.schemarouter.migration.MigrationStateTracker;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRecord;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import io.b2mash.b2b.schemarouter.provisioning.SchemaLifecycleManager;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Administrative operations behind {@code --admin.command}. Every method returns a process exit
 * code: {@link #SUCCESS}, {@link #FAILURE} or {@link #USAGE_ERROR}.
 */
@Service
public class TenantAdminCommands {

  private static final Logger log = LoggerFactory.getLogger(TenantAdminCommands.class);

  public static final int SUCCESS = 0;
  public static final int FAILURE = 1;
  public static final int USAGE_ERROR = 2;

  public static final String ALL_TENANTS = "all";

  private final SchemaLifecycleManager lifecycleManager;
  private final TenantRegistry registry;
  private final MigrationStateTracker tracker;
  private final MigrationGraph sharedGraph;
  private final MigrationGraph tenantGraph;
  private final MigrationGenerator generator;
  private final PrintStream out;

  @Autowired
  public TenantAdminCommands(
      SchemaLifecycleManager lifecycleManager,
      TenantRegistry registry,
      MigrationStateTracker tracker,
      @Qualifier("sharedMigrationGraph") MigrationGraph sharedGraph,
      @Qualifier("tenantMigrationGraph") MigrationGraph tenantGraph,
      MigrationGenerator generator) {
    this(lifecycleManager, registry, tracker, sharedGraph, tenantGraph, generator, System.out);
  }

  public TenantAdminCommands(
      SchemaLifecycleManager lifecycleManager,
      TenantRegistry registry,
      MigrationStateTracker tracker,
      MigrationGraph sharedGraph,
      MigrationGraph tenantGraph,
      MigrationGenerator generator,
      PrintStream out) {
    this.lifecycleManager = lifecycleManager;
    this.registry = registry;
    this.tracker = tracker;
    this.sharedGraph = sharedGraph;
    this.tenantGraph = tenantGraph;
    this.generator = generator;
    this.out = out;
  }

  /** Provisions the schema of an already registered tenant. */
  public int createTenantSchema(String identifier) {
    if (isBlank(identifier)) {
      return usage("create-tenant-schema requires --admin.target=<identifier>");
    }
    try {
      TenantRecord record = lifecycleManager.provision(identifier);
      out.printf(
          "Tenant %s is %s in schema %s%n", identifier, record.status(), record.schemaName());
      return SUCCESS;
    } catch (RuntimeException e) {
      return failure("create-tenant-schema " + identifier, e);
    }
  }

  /** Scaffolds a new tenant migration named after {@code label}. */
  public int makeMigrationsTenant(String label) {
    try {
      Path file = generator.generate(label);
      out.printf("Created tenant migration %s%n", file);
      return SUCCESS;
    } catch (RuntimeException e) {
      return failure("makemigrations-tenant", e);
    }
  }

  /** Migrates one tenant, or every ACTIVE tenant when {@code target} is {@value #ALL_TENANTS}. */
  public int migrateTenant(String target) {
    if (isBlank(target)) {
      return usage("migrate-tenant requires --admin.target=<identifier|all>");
    }
    if (ALL_TENANTS.equals(target)) {
      BulkMigrationReport report = lifecycleManager.migrateAll();
      out.println(report.format());
      return report.hasFailures() || report.cancelled() ? FAILURE : SUCCESS;
    }
    try {
      List<String> applied = lifecycleManager.migrate(target);
      out.printf("Tenant %s: %s%n", target, describe(applied));
      return SUCCESS;
    } catch (RuntimeException e) {
      return failure("migrate-tenant " + target, e);
    }
  }

  public int migrateShared() {
    try {
      List<String> applied = lifecycleManager.migrateShared(sharedGraph);
      out.printf("Shared schema %s: %s%n", registry.sharedSchema(), describe(applied));
      return SUCCESS;
    } catch (RuntimeException e) {
      return failure("migrate-shared", e);
    }
  }

  /** Prints applied and pending tenant migrations for one tenant. */
  public int showMigrations(String identifier) {
    if (isBlank(identifier)) {
      return usage("show-migrations requires --admin.target=<identifier>");
    }
    try {
      String schema = registry.require(identifier).schemaName();
      Set<String> applied = tracker.appliedMigrations(schema);
      List<String> pending = tracker.pendingMigrations(schema, tenantGraph);
      out.printf("Schema %s%n", schema);
      applied.forEach(id -> out.printf("  [X] %s%n", id));
      pending.forEach(id -> out.printf("  [ ] %s%n", id));
      return SUCCESS;
    } catch (RuntimeException e) {
      return failure("show-migrations " + identifier, e);
    }
  }

  private static String describe(List<String> applied) {
    return applied.isEmpty() ? "up to date" : "applied " + String.join(", ", applied);
  }

  private int usage(String message) {
    out.println(message);
    return USAGE_ERROR;
  }

  private int failure(String command, RuntimeException e) {
    log.error("Command {} failed", command, e);
    out.printf("%s failed: %s%n", command, e.getMessage());
    return FAILURE;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
