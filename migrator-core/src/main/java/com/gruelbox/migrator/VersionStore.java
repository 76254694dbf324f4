package com.gruelbox.migrator;

import com.gruelbox.migrator.jdbc.JdbcTransaction;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Records which migrations have been applied to the database. For most use cases, just use {@link
 * DefaultVersionStore}. Every method works within the transaction it is given, so {@link
 * #recordApplied} and {@link #recordReverted} commit or roll back with the migration they record.
 */
public interface VersionStore {

  /**
   * Uses the default relational store. Shortcut for: <code>
   * DefaultVersionStore.builder().dialect(dialect).build();</code>
   *
   * @param dialect The database dialect.
   * @return The store.
   */
  static DefaultVersionStore forDialect(Dialect dialect) {
    return DefaultVersionStore.builder().dialect(dialect).build();
  }

  /**
   * Creates the versions table if it does not exist. Must be called before anything else on a
   * fresh database. Some databases commit DDL implicitly, so this should run in a transaction of
   * its own.
   *
   * @param tx The current transaction.
   * @throws SQLException If the table could not be created.
   */
  void ensureSchema(JdbcTransaction tx) throws SQLException;

  /**
   * @param tx The current transaction.
   * @return Every applied version, ordered by version ascending.
   * @throws SQLException On any query error.
   */
  List<AppliedVersion> listApplied(JdbcTransaction tx) throws SQLException;

  /**
   * @param tx The current transaction.
   * @return The greatest applied version, or empty if none are applied.
   * @throws SQLException On any query error. Absence of rows is not an error.
   */
  Optional<String> currentVersion(JdbcTransaction tx) throws SQLException;

  /**
   * Records that the up action of a migration has run.
   *
   * @param tx The transaction in which the up action ran.
   * @param version The version.
   * @param name The migration name.
   * @throws SQLException On any error.
   */
  void recordApplied(JdbcTransaction tx, String version, String name) throws SQLException;

  /**
   * Records that the down action of a migration has run.
   *
   * @param tx The transaction in which the down action ran.
   * @param version The version.
   * @throws SQLException On any error.
   */
  void recordReverted(JdbcTransaction tx, String version) throws SQLException;
}
