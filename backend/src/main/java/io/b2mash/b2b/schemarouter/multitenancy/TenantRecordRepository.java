package io.b2mash.b2b.schemarouter.multitenancy;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to {@code <shared>.tenant_registry}. Each write is a single statement, so the
 * database's own atomicity is the only locking involved.
 */
@Repository
public class TenantRecordRepository {

  private static final String COLUMNS =
      "identifier, schema_name, status, created_at, updated_at";

  private final JdbcClient jdbc;
  private final String table;

  public TenantRecordRepository(
      @Qualifier("migrationJdbcClient") JdbcClient jdbc,
      @Value("${tenancy.public-schema-name:public}") String sharedSchema) {
    this.jdbc = jdbc;
    this.table = SchemaNames.quote(sharedSchema) + ".tenant_registry";
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  /**
   * Inserts a live record. Fails with {@link org.springframework.dao.DuplicateKeyException} when
   * the identifier or schema name is already held by a live record.
   */
  public void insert(TenantRecord record) {
    jdbc.sql(
            "INSERT INTO "
                + table
                + " (identifier, schema_name, status, live, created_at, updated_at)"
                + " VALUES (?, ?, ?, TRUE, ?, ?)")
        .params(
            record.identifier(),
            record.schemaName(),
            record.status().name(),
            toTimestamp(record.createdAt()),
            toTimestamp(record.updatedAt()))
        .update();
  }

  public Optional<TenantRecord> findLiveByIdentifier(String identifier) {
    return jdbc.sql(
            "SELECT " + COLUMNS + " FROM " + table + " WHERE identifier = ? AND live = TRUE")
        .param(identifier)
        .query(TenantRecordRepository::mapRow)
        .optional();
  }

  public Optional<TenantRecord> findLiveBySchemaName(String schemaName) {
    return jdbc.sql(
            "SELECT " + COLUMNS + " FROM " + table + " WHERE schema_name = ? AND live = TRUE")
        .param(schemaName)
        .query(TenantRecordRepository::mapRow)
        .optional();
  }

  public boolean existsLive(String identifier, String schemaName) {
    Integer count =
        jdbc.sql(
                "SELECT COUNT(*) FROM "
                    + table
                    + " WHERE live = TRUE AND (identifier = ? OR schema_name = ?)")
            .params(identifier, schemaName)
            .query(Integer.class)
            .single();
    return count != null && count > 0;
  }

  /**
   * Moves a live record from {@code expected} to {@code target}. Returns false when the record is
   * no longer in the expected status, which callers treat as a lost race.
   */
  public boolean updateStatus(
      String identifier, TenantStatus expected, TenantStatus target, Instant now) {
    int updated =
        jdbc.sql(
                "UPDATE "
                    + table
                    + " SET status = ?, live = "
                    + (target == TenantStatus.DROPPED ? "NULL" : "TRUE")
                    + ", updated_at = ?"
                    + " WHERE identifier = ? AND status = ? AND live = TRUE")
            .params(target.name(), toTimestamp(now), identifier, expected.name())
            .update();
    return updated == 1;
  }

  /** Keyset page of records in {@code status}, ordered by identifier. */
  public List<TenantRecord> findPageByStatus(
      TenantStatus status, String afterIdentifier, int limit) {
    String after = afterIdentifier != null ? afterIdentifier : "";
    return jdbc.sql(
            "SELECT "
                + COLUMNS
                + " FROM "
                + table
                + " WHERE status = ? AND identifier > ? ORDER BY identifier LIMIT ?")
        .params(status.name(), after, limit)
        .query(TenantRecordRepository::mapRow)
        .list();
  }

  /** Full history for an identifier, dropped records included, oldest first. */
  public List<TenantRecord> findHistory(String identifier) {
    return jdbc.sql(
            "SELECT " + COLUMNS + " FROM " + table + " WHERE identifier = ? ORDER BY id")
        .param(identifier)
        .query(TenantRecordRepository::mapRow)
        .list();
  }

  private static TenantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TenantRecord(
        rs.getString("identifier"),
        rs.getString("schema_name"),
        TenantStatus.valueOf(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
