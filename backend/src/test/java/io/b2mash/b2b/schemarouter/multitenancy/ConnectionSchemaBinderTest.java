package io.b2mash.b2b.schemarouter.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.schemarouter.exception.ConnectionLeakDetectedException;
import io.b2mash.b2b.schemarouter.exception.SchemaNotFoundException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;

@ExtendWith(MockitoExtension.class)
class ConnectionSchemaBinderTest {

  @Mock private DataSource dataSource;
  @Mock private Connection connection;

  private ConnectionSchemaBinder binder;

  @BeforeEach
  void setUp() {
    Set<String> activeSchemas = Set.of("acme", "beta");
    binder = new ConnectionSchemaBinder(dataSource, "public", activeSchemas::contains);
  }

  @Test
  void withSchema_bindsRunsAndRestoresPriorSchema() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");

    String result =
        binder.withSchema(
            "acme",
            conn -> {
              assertThat(SchemaContext.require()).isEqualTo("acme");
              return "done";
            });

    assertThat(result).isEqualTo("done");
    var order = inOrder(connection);
    order.verify(connection).setSchema("acme");
    order.verify(connection).setSchema("public");
    order.verify(connection).close();
    verify(connection, never()).abort(any());
    assertThat(SchemaContext.depth()).isZero();
  }

  @Test
  void withSchema_restoresWhenOperationFails() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");

    assertThatThrownBy(
            () ->
                binder.withSchema(
                    "acme",
                    conn -> {
                      throw new IllegalStateException("operation failed");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("operation failed");

    verify(connection).setSchema("public");
    verify(connection).close();
    assertThat(SchemaContext.depth()).isZero();
  }

  @Test
  void withSchema_translatesSqlExceptionFromOperation() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");

    assertThatThrownBy(
            () ->
                binder.withSchema(
                    "acme",
                    conn -> {
                      throw new SQLException("relation does not exist", "42P01");
                    }))
        .isInstanceOf(DataAccessException.class);

    verify(connection).setSchema("public");
    verify(connection).close();
  }

  @Test
  void withSchema_unknownSchemaNeverTouchesThePool() {
    assertThatThrownBy(() -> binder.withSchema("ghost", conn -> null))
        .isInstanceOf(SchemaNotFoundException.class);

    verifyNoInteractions(dataSource);
  }

  @Test
  void withSchema_unsafeSchemaNameIsNotFound() {
    assertThatThrownBy(() -> binder.withSchema("acme\"; DROP", conn -> null))
        .isInstanceOf(SchemaNotFoundException.class);

    verifyNoInteractions(dataSource);
  }

  @Test
  void withSharedSchema_isAlwaysBindable() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");

    binder.withSharedSchema(conn -> null);

    verify(connection, times(2)).setSchema("public");
  }

  @Test
  void failedRestore_evictsConnectionAndReportsLeak() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");
    doNothing().when(connection).setSchema("acme");
    doThrow(new SQLException("connection reset")).when(connection).setSchema("public");

    assertThatThrownBy(() -> binder.withSchema("acme", conn -> "ok"))
        .isInstanceOf(ConnectionLeakDetectedException.class)
        .hasMessageContaining("acme");

    verify(connection).abort(any());
    verify(connection).close();
    assertThat(SchemaContext.depth()).isZero();
  }

  @Test
  void unconfirmedRestore_evictsConnection() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    // Session keeps reporting the tenant schema after the restore
    when(connection.getSchema()).thenReturn("public", "acme");

    assertThatThrownBy(() -> binder.withSchema("acme", conn -> "ok"))
        .isInstanceOf(ConnectionLeakDetectedException.class);

    verify(connection).abort(any());
  }

  @Test
  void failedRestoreAfterFailedOperation_keepsOperationFailureAsSuppressed() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");
    doNothing().when(connection).setSchema("acme");
    doThrow(new SQLException("connection reset")).when(connection).setSchema("public");

    var operationFailure = new IllegalStateException("operation failed");
    assertThatThrownBy(
            () ->
                binder.withSchema(
                    "acme",
                    conn -> {
                      throw operationFailure;
                    }))
        .isInstanceOf(ConnectionLeakDetectedException.class)
        .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(operationFailure));
  }

  @Test
  void failedBind_discardsConnectionWithoutRunningOperation() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.getSchema()).thenReturn("public");
    doThrow(new SQLException("schema missing")).when(connection).setSchema("acme");

    assertThatThrownBy(
            () ->
                binder.withSchema(
                    "acme",
                    conn -> {
                      throw new AssertionError("must not run");
                    }))
        .isInstanceOf(DataAccessException.class);

    verify(connection).abort(any());
    assertThat(SchemaContext.depth()).isZero();
  }

  @Test
  void restore_withoutPriorSchemaFallsBackToShared() throws SQLException {
    when(connection.getSchema()).thenReturn("public");

    binder.restore(connection, null);

    verify(connection).setSchema("public");
  }
}
