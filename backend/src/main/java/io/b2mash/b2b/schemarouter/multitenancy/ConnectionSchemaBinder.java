package io.b2mash.b2b.schemarouter.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.b2b.schemarouter.exception.ConnectionLeakDetectedException;
import io.b2mash.b2b.schemarouter.exception.SchemaNotFoundException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Predicate;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * Binds a schema onto pooled connections for the duration of one operation.
 *
 * <p>The session schema ({@code search_path} on PostgreSQL) is set through {@link
 * Connection#setSchema} before the operation runs and put back to its prior value on every exit
 * path before the connection goes back to the pool. A connection whose restore fails or cannot be
 * verified is evicted from the pool instead of being reused, because the next borrower would
 * otherwise run against this operation's schema.
 */
public class ConnectionSchemaBinder {

  private static final Logger log = LoggerFactory.getLogger(ConnectionSchemaBinder.class);

  private final DataSource dataSource;
  private final String sharedSchema;
  private final Predicate<String> tenantSchemaCheck;
  private final SQLExceptionTranslator exceptionTranslator;

  /**
   * @param tenantSchemaCheck decides whether a non-shared schema may be bound; the application
   *     binder asks the registry for an ACTIVE tenant, the migration binder accepts any safe name
   */
  public ConnectionSchemaBinder(
      DataSource dataSource, String sharedSchema, Predicate<String> tenantSchemaCheck) {
    this.dataSource = dataSource;
    this.sharedSchema = SchemaNames.requireSafe(sharedSchema);
    this.tenantSchemaCheck = tenantSchemaCheck;
    this.exceptionTranslator = new SQLExceptionSubclassTranslator();
  }

  /** Binder for the application pool: only the shared schema and ACTIVE tenant schemas. */
  public static ConnectionSchemaBinder forTenants(DataSource dataSource, TenantRegistry registry) {
    return new ConnectionSchemaBinder(
        dataSource, registry.sharedSchema(), registry::isActiveSchema);
  }

  /** Binder for administrative work, where schemas may still be provisioning. */
  public static ConnectionSchemaBinder forMigrations(DataSource dataSource, String sharedSchema) {
    return new ConnectionSchemaBinder(dataSource, sharedSchema, SchemaNames::isSafe);
  }

  public String sharedSchema() {
    return sharedSchema;
  }

  /**
   * Runs {@code operation} on a pooled connection bound to {@code schemaName}, with {@link
   * SchemaContext} reflecting the same schema while it runs.
   *
   * @throws SchemaNotFoundException if the schema is neither shared nor bindable
   * @throws ConnectionLeakDetectedException if the connection could not be restored; it has been
   *     evicted by then
   */
  public <T> T withSchema(String schemaName, ConnectionCallback<T> operation) {
    checkBindable(schemaName);
    Connection connection = acquire(schemaName);
    String prior;
    try {
      prior = bind(connection, schemaName);
    } catch (SQLException e) {
      // Nothing ran on it, but its schema state is unknown now
      discard(connection, schemaName, e);
      throw translate("bind schema " + schemaName, e);
    }

    Throwable failure = null;
    SchemaContext.push(schemaName);
    try {
      return operation.doInConnection(connection);
    } catch (SQLException e) {
      DataAccessException translated = translate("operation in schema " + schemaName, e);
      failure = translated;
      throw translated;
    } catch (RuntimeException | Error e) {
      failure = e;
      throw e;
    } finally {
      try {
        SchemaContext.pop();
      } finally {
        release(connection, schemaName, prior, failure);
      }
    }
  }

  /** Runs {@code operation} against the shared schema. */
  public <T> T withSharedSchema(ConnectionCallback<T> operation) {
    return withSchema(sharedSchema, operation);
  }

  /**
   * Sets {@code schemaName} on an already borrowed connection and returns the schema it replaced.
   * Callers own the matching {@link #restore} call.
   */
  public String bind(Connection connection, String schemaName) throws SQLException {
    SchemaNames.requireSafe(schemaName);
    String prior = connection.getSchema();
    connection.setSchema(schemaName);
    log.debug("Bound schema {} (was {})", schemaName, prior);
    return prior;
  }

  /**
   * Puts the connection back on {@code priorSchema} and confirms the session reports it. Throws
   * {@link SQLException} if either step fails; the caller must then discard the connection.
   */
  public void restore(Connection connection, String priorSchema) throws SQLException {
    String target = priorSchema != null ? priorSchema : sharedSchema;
    connection.setSchema(target);
    String actual = connection.getSchema();
    if (!Objects.equals(target, actual)) {
      throw new SQLException(
          "Schema restore not confirmed: expected " + target + " but session reports " + actual);
    }
  }

  /**
   * Evicts a connection whose schema state can no longer be trusted. With HikariCP it is removed
   * from the pool; for other pools it is aborted so the pool treats it as broken.
   */
  public void discard(Connection connection, String boundSchema, Throwable cause) {
    log.error(
        "CRITICAL: evicting connection still bound to schema {}; prior tenant isolation may have"
            + " been compromised",
        boundSchema,
        cause);
    try {
      if (dataSource.isWrapperFor(HikariDataSource.class)) {
        dataSource.unwrap(HikariDataSource.class).evictConnection(connection);
      } else {
        connection.abort(Runnable::run);
      }
    } catch (SQLException | RuntimeException e) {
      log.error("Failed to evict connection bound to schema {}", boundSchema, e);
    }
    closeQuietly(connection);
  }

  /** Throws {@link SchemaNotFoundException} unless the schema is shared or passes the check. */
  public void checkBindable(String schemaName) {
    if (sharedSchema.equals(schemaName)) {
      return;
    }
    if (!SchemaNames.isSafe(schemaName) || !tenantSchemaCheck.test(schemaName)) {
      throw new SchemaNotFoundException(schemaName);
    }
  }

  private Connection acquire(String schemaName) {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw new CannotGetJdbcConnectionException(
          "Failed to obtain connection for schema " + schemaName, e);
    }
  }

  private void release(Connection connection, String schemaName, String prior, Throwable failure) {
    try {
      restore(connection, prior);
    } catch (SQLException | RuntimeException e) {
      discard(connection, schemaName, e);
      var leak = new ConnectionLeakDetectedException(schemaName, e);
      if (failure != null) {
        leak.addSuppressed(failure);
      }
      throw leak;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to return connection to pool after schema {}", schemaName, e);
    }
  }

  private DataAccessException translate(String task, SQLException e) {
    DataAccessException translated = exceptionTranslator.translate(task, null, e);
    return translated != null ? translated : new UncategorizedSQLException(task, null, e);
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      log.debug("Ignoring close failure on discarded connection", e);
    }
  }
}
