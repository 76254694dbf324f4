package com.gruelbox.migrator;

import com.gruelbox.migrator.jdbc.JdbcTransaction;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

/**
 * The default {@link VersionStore}.
 *
 * <p>Keeps one row per applied migration in a relational table, by default called {@code
 * versions}, with the columns {@code id}, {@code version}, {@code name} and {@code created_at}. The
 * layout is a contract with any other tooling reading the table, so only the table name is
 * configurable.
 *
 * <p>Subclassing is supported for minor variations.
 */
@Slf4j
@SuperBuilder
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public class DefaultVersionStore implements VersionStore, Validatable {

  /**
   * @param dialect The database dialect to use. Required.
   */
  @SuppressWarnings("JavaDoc")
  private final Dialect dialect;

  /**
   * @param tableName The database table name. The default is {@code versions}.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  private final String tableName = "versions";

  @Override
  public void validate(Validator validator) {
    validator.notNull("dialect", dialect);
    validator.notBlank("tableName", tableName);
  }

  @Override
  public void ensureSchema(JdbcTransaction tx) throws SQLException {
    log.debug("Ensuring {} exists ({})", tableName, dialect.getName());
    try (Statement s = tx.connection().createStatement()) {
      s.execute(sql(dialect.getCreateVersionTable()));
    }
  }

  @Override
  public List<AppliedVersion> listApplied(JdbcTransaction tx) throws SQLException {
    List<AppliedVersion> result = new ArrayList<>();
    String selectSql = sql("SELECT id, version, name, created_at FROM {{table}} ORDER BY version");
    try (PreparedStatement s = tx.connection().prepareStatement(selectSql);
        ResultSet rs = s.executeQuery()) {
      while (rs.next()) {
        result.add(
            new AppliedVersion(
                rs.getLong("id"),
                rs.getString("version"),
                rs.getString("name"),
                rs.getTimestamp("created_at").toInstant()));
      }
    }
    return result;
  }

  @Override
  public Optional<String> currentVersion(JdbcTransaction tx) throws SQLException {
    try (PreparedStatement s =
            tx.connection().prepareStatement(sql(dialect.getFetchCurrentVersion()));
        ResultSet rs = s.executeQuery()) {
      if (rs.next()) {
        return Optional.of(rs.getString(1));
      }
      return Optional.empty();
    }
  }

  @Override
  public void recordApplied(JdbcTransaction tx, String version, String name) throws SQLException {
    var insertSql = sql("INSERT INTO {{table}} (version, name) VALUES (?, ?)");
    try (PreparedStatement s = tx.connection().prepareStatement(insertSql)) {
      s.setString(1, version);
      s.setString(2, name);
      s.executeUpdate();
    }
    log.debug("Recorded {} as applied", version);
  }

  @Override
  public void recordReverted(JdbcTransaction tx, String version) throws SQLException {
    var deleteSql = sql("DELETE FROM {{table}} WHERE version = ?");
    try (PreparedStatement s = tx.connection().prepareStatement(deleteSql)) {
      s.setString(1, version);
      int deleted = s.executeUpdate();
      if (deleted == 0) {
        log.warn("No record of {} in {} to remove", version, tableName);
      }
    }
  }

  private String sql(String format) {
    return format.replace("{{table}}", tableName);
  }
}
