package io.b2mash.b2b.schemarouter.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.hibernate.engine.jdbc.connections.spi.MultiTenantConnectionProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Hands Hibernate sessions connections bound to the session's tenant schema. Binding, restore and
 * eviction are delegated to {@link ConnectionSchemaBinder} so ORM traffic follows the same rules
 * as plain JDBC work.
 */
@Component
public class SchemaMultiTenantConnectionProvider implements MultiTenantConnectionProvider<String> {

  private final DataSource dataSource;
  private final ConnectionSchemaBinder binder;
  private final Map<Connection, String> priorSchemas =
      Collections.synchronizedMap(new IdentityHashMap<>());

  public SchemaMultiTenantConnectionProvider(
      @Qualifier("appDataSource") DataSource dataSource,
      @Qualifier("appSchemaBinder") ConnectionSchemaBinder binder) {
    this.dataSource = dataSource;
    this.binder = binder;
  }

  @Override
  public Connection getAnyConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void releaseAnyConnection(Connection connection) throws SQLException {
    connection.close();
  }

  @Override
  public Connection getConnection(String schemaName) throws SQLException {
    binder.checkBindable(schemaName);
    Connection connection = getAnyConnection();
    try {
      priorSchemas.put(connection, binder.bind(connection, schemaName));
    } catch (SQLException e) {
      binder.discard(connection, schemaName, e);
      throw e;
    }
    return connection;
  }

  @Override
  public void releaseConnection(String schemaName, Connection connection) throws SQLException {
    String prior = priorSchemas.remove(connection);
    try {
      binder.restore(connection, prior);
    } catch (SQLException e) {
      binder.discard(connection, schemaName, e);
      throw e;
    }
    releaseAnyConnection(connection);
  }

  @Override
  public boolean supportsAggressiveRelease() {
    return false;
  }

  @Override
  public boolean isUnwrappableAs(Class<?> unwrapType) {
    return MultiTenantConnectionProvider.class.isAssignableFrom(unwrapType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T unwrap(Class<T> unwrapType) {
    if (isUnwrappableAs(unwrapType)) {
      return (T) this;
    }
    throw new IllegalArgumentException("Cannot unwrap to " + unwrapType);
  }
}
