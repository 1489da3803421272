package io.b2mash.b2b.schemarouter.provisioning;

import io.b2mash.b2b.schemarouter.command.AdminCommandRunner;
import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Brings the shared schema and every ACTIVE tenant schema up to date at boot. A failing shared
 * schema stops startup; failing tenant schemas are logged and left for {@code migrate-tenant}.
 * Skipped when the process was started to run an administrative command.
 */
@Component
@Order(0)
@ConditionalOnProperty(
    name = "tenancy.migration.run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class StartupMigrationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(StartupMigrationRunner.class);

  private final SchemaLifecycleManager lifecycleManager;
  private final MigrationGraph sharedGraph;

  public StartupMigrationRunner(
      SchemaLifecycleManager lifecycleManager,
      @Qualifier("sharedMigrationGraph") MigrationGraph sharedGraph) {
    this.lifecycleManager = lifecycleManager;
    this.sharedGraph = sharedGraph;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (args.containsOption(AdminCommandRunner.COMMAND_OPTION)) {
      log.info("Administrative command requested; skipping startup migrations");
      return;
    }
    lifecycleManager.migrateShared(sharedGraph);
    BulkMigrationReport report = lifecycleManager.migrateAll();
    if (report.hasFailures()) {
      log.error(
          "Tenant migrations failed on some schemas:{}{}", System.lineSeparator(), report.format());
    } else {
      log.info("Tenant migrations complete for {} schemas", report.outcomes().size());
    }
  }
}
