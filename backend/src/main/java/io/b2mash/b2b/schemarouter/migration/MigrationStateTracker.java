package io.b2mash.b2b.schemarouter.migration;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.b2b.schemarouter.config.TenancyProperties;
import io.b2mash.b2b.schemarouter.exception.MigrationFailedException;
import io.b2mash.b2b.schemarouter.migration.BulkMigrationReport.SchemaOutcome;
import io.b2mash.b2b.schemarouter.multitenancy.ConnectionSchemaBinder;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Applies migration graphs to schemas and keeps each schema's ledger.
 *
 * <p>Within a schema, migrations run one at a time in dependency order. Each runs in its own
 * transaction together with its ledger insert, so a failed migration leaves neither its effect nor
 * a ledger entry behind. Across schemas, bulk runs proceed in parallel and a failing schema never
 * stops the others.
 */
@Service
public class MigrationStateTracker {

  private static final Logger log = LoggerFactory.getLogger(MigrationStateTracker.class);

  private final ConnectionSchemaBinder binder;
  private final int maxWorkers;
  private final Clock clock;

  /** Caps bulk parallelism at the migration pool's size, since each worker holds a connection. */
  @Autowired
  public MigrationStateTracker(
      @Qualifier("migrationSchemaBinder") ConnectionSchemaBinder binder,
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenancyProperties properties,
      Clock clock) {
    this(
        binder,
        Math.max(
            1,
            Math.min(
                properties.migration().bulkWorkers(), migrationDataSource.getMaximumPoolSize())),
        clock);
  }

  /**
   * @param binder binder over the migration pool
   * @param maxWorkers bulk parallelism; callers keep this at or below the pool's size since each
   *     in-flight schema holds one connection
   */
  public MigrationStateTracker(ConnectionSchemaBinder binder, int maxWorkers, Clock clock) {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("maxWorkers must be at least 1, was " + maxWorkers);
    }
    this.binder = binder;
    this.maxWorkers = maxWorkers;
    this.clock = clock;
  }

  public Set<String> appliedMigrations(String schemaName) {
    return binder.withSchema(schemaName, conn -> MigrationLedger.applied(conn, schemaName));
  }

  /** Migrations of {@code graph} not yet applied to the schema, in the order they would run. */
  public List<String> pendingMigrations(String schemaName, MigrationGraph graph) {
    return binder.withSchema(
        schemaName,
        conn ->
            graph.plan(schemaName, MigrationLedger.applied(conn, schemaName)).stream()
                .map(Migration::id)
                .toList());
  }

  /**
   * Applies every pending migration of {@code graph} to the schema. Already applied migrations are
   * skipped, so repeated calls are no-ops.
   *
   * @return ids applied by this call, in order
   * @throws io.b2mash.b2b.schemarouter.exception.MigrationConflictException if the graph cannot be
   *     ordered against the ledger
   * @throws MigrationFailedException if a migration fails; earlier ones in this call stay applied
   */
  public List<String> apply(String schemaName, MigrationGraph graph) {
    return binder.withSchema(
        schemaName,
        conn -> {
          MigrationLedger.ensure(conn, schemaName);
          List<Migration> plan = graph.plan(schemaName, MigrationLedger.applied(conn, schemaName));
          if (plan.isEmpty()) {
            log.debug("Schema {} is up to date with the {} graph", schemaName, graph.category());
            return List.of();
          }
          List<String> applied = new ArrayList<>(plan.size());
          for (Migration migration : plan) {
            if (applyOne(conn, schemaName, migration, applied)) {
              applied.add(migration.id());
            }
          }
          log.info("Migrated schema {}: {} migrations applied", schemaName, applied.size());
          return applied;
        });
  }

  private boolean applyOne(
      Connection conn, String schemaName, Migration migration, List<String> appliedSoFar)
      throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      // Another runner may have applied it since the plan was computed
      if (MigrationLedger.isApplied(conn, schemaName, migration.id())) {
        conn.rollback();
        return false;
      }
      migration.action().apply(conn);
      MigrationLedger.record(conn, schemaName, migration.id(), clock.instant());
      conn.commit();
      log.info("Applied migration {} to schema {}", migration.id(), schemaName);
      return true;
    } catch (SQLException | RuntimeException e) {
      rollback(conn, schemaName, migration.id());
      throw new MigrationFailedException(schemaName, migration.id(), e, appliedSoFar);
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  private static void rollback(Connection conn, String schemaName, String migrationId) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      log.error("Rollback of migration {} on schema {} failed", migrationId, schemaName, e);
    }
  }

  /**
   * Applies {@code graph} to every schema independently. Failures are captured per schema in the
   * report. Interrupting the calling thread cancels the run at schema boundaries: schemas already
   * migrating finish, the rest are reported as SKIPPED, and the interrupt flag is restored.
   */
  public BulkMigrationReport applyAcrossSchemas(
      Iterable<String> schemaNames, MigrationGraph graph) {
    List<String> schemas = new ArrayList<>();
    schemaNames.forEach(schemas::add);
    if (schemas.isEmpty()) {
      return new BulkMigrationReport(List.of(), false);
    }

    int workers = Math.min(maxWorkers, schemas.size());
    log.info(
        "Applying {} graph to {} schemas with {} workers",
        graph.category(),
        schemas.size(),
        workers);

    AtomicBoolean cancelled = new AtomicBoolean(false);
    ExecutorService executor =
        Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("schema-migrate-"));
    List<Future<SchemaOutcome>> futures = new ArrayList<>(schemas.size());
    boolean interrupted = false;
    try {
      for (String schema : schemas) {
        futures.add(executor.submit(() -> migrateOne(schema, graph, cancelled)));
      }
      List<SchemaOutcome> outcomes = new ArrayList<>(schemas.size());
      for (int i = 0; i < futures.size(); i++) {
        while (true) {
          try {
            outcomes.add(futures.get(i).get());
            break;
          } catch (InterruptedException e) {
            interrupted = true;
            cancelled.set(true);
          } catch (ExecutionException e) {
            outcomes.add(SchemaOutcome.failed(schemas.get(i), describe(e.getCause())));
            break;
          }
        }
      }
      var report = new BulkMigrationReport(outcomes, cancelled.get());
      log.info(
          "Bulk {} migration finished: {} succeeded, {} failed, {} skipped",
          graph.category(),
          report.withStatus(BulkMigrationReport.Status.SUCCEEDED).size(),
          report.withStatus(BulkMigrationReport.Status.FAILED).size(),
          report.withStatus(BulkMigrationReport.Status.SKIPPED).size());
      return report;
    } finally {
      executor.shutdown();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private SchemaOutcome migrateOne(String schema, MigrationGraph graph, AtomicBoolean cancelled) {
    if (cancelled.get()) {
      return SchemaOutcome.skipped(schema);
    }
    try {
      return SchemaOutcome.succeeded(schema, apply(schema, graph));
    } catch (MigrationFailedException e) {
      log.error(
          "Migration of schema {} failed after applying {}",
          schema,
          e.getAppliedBeforeFailure(),
          e);
      return SchemaOutcome.failed(schema, e.getAppliedBeforeFailure(), describe(e));
    } catch (RuntimeException e) {
      log.error("Migration of schema {} failed", schema, e);
      return SchemaOutcome.failed(schema, describe(e));
    }
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root != e && root.getMessage() != null) {
      message = message + ": " + root.getMessage();
    }
    return message;
  }
}
