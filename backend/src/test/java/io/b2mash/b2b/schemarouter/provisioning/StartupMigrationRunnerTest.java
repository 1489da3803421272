package io.b2mash.b2b.schemarouter.provisioning;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport;
import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport.SchemaOutcome;
import io.b2mash.b2b.schemarouter.migration.MigrationCategory;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class StartupMigrationRunnerTest {

  @Mock private SchemaLifecycleManager lifecycleManager;

  private final MigrationGraph sharedGraph = MigrationGraph.of(MigrationCategory.SHARED, List.of());

  @Test
  void migratesSharedSchemaBeforeTenants() {
    when(lifecycleManager.migrateAll())
        .thenReturn(
            new BulkMigrationReport(
                List.of(SchemaOutcome.failed("acme", "Migration 0002_note failed")), false));

    new StartupMigrationRunner(lifecycleManager, sharedGraph)
        .run(new DefaultApplicationArguments());

    var order = inOrder(lifecycleManager);
    order.verify(lifecycleManager).migrateShared(sharedGraph);
    order.verify(lifecycleManager).migrateAll();
  }

  @Test
  void skippedWhenAdministrativeCommandRequested() {
    new StartupMigrationRunner(lifecycleManager, sharedGraph)
        .run(new DefaultApplicationArguments("--admin.command=migrate-tenant"));

    verify(lifecycleManager, never()).migrateShared(any());
    verify(lifecycleManager, never()).migrateAll();
  }
}
