package io.b2mash.b2b.schemarouter.migration;

import io.b2mash.b2b.schemarouter.multitenancy.SchemaNames;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/** Reads and writes {@code <schema>.schema_migrations}, the per-schema record of applied ids. */
public final class MigrationLedger {

  public static final String TABLE = "schema_migrations";

  private MigrationLedger() {}

  private static String table(String schemaName) {
    return SchemaNames.quote(schemaName) + "." + TABLE;
  }

  static void ensure(Connection connection, String schemaName) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS "
              + table(schemaName)
              + " (migration_id VARCHAR(255) PRIMARY KEY,"
              + " applied_at TIMESTAMP WITH TIME ZONE NOT NULL)");
    }
  }

  static boolean exists(Connection connection, String schemaName) throws SQLException {
    try (var rs = connection.getMetaData().getTables(null, schemaName, TABLE, null)) {
      return rs.next();
    }
  }

  /** Applied ids in application order. Empty when the schema has no ledger yet. */
  static Set<String> applied(Connection connection, String schemaName) throws SQLException {
    Set<String> ids = new LinkedHashSet<>();
    if (!exists(connection, schemaName)) {
      return ids;
    }
    try (var stmt =
            connection.prepareStatement(
                "SELECT migration_id FROM "
                    + table(schemaName)
                    + " ORDER BY applied_at, migration_id");
        var rs = stmt.executeQuery()) {
      while (rs.next()) {
        ids.add(rs.getString(1));
      }
    }
    return ids;
  }

  static boolean isApplied(Connection connection, String schemaName, String migrationId)
      throws SQLException {
    try (var stmt =
        connection.prepareStatement(
            "SELECT 1 FROM " + table(schemaName) + " WHERE migration_id = ?")) {
      stmt.setString(1, migrationId);
      try (var rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  static void record(Connection connection, String schemaName, String migrationId, Instant at)
      throws SQLException {
    try (var stmt =
        connection.prepareStatement(
            "INSERT INTO " + table(schemaName) + " (migration_id, applied_at) VALUES (?, ?)")) {
      stmt.setString(1, migrationId);
      stmt.setTimestamp(2, Timestamp.from(at));
      stmt.executeUpdate();
    }
  }
}
