package io.b2mash.b2b.schemarouter.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The effect of one migration. Runs inside a transaction on a connection already bound to the
 * target schema, so unqualified names resolve there.
 */
@FunctionalInterface
public interface MigrationAction {

  void apply(Connection connection) throws SQLException;
}
