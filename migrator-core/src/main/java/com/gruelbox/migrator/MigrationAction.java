package com.gruelbox.migrator;

import com.gruelbox.migrator.jdbc.JdbcTransaction;

/**
 * The body of one direction of a {@link Migration}. Runs inside the transaction the migrator opens
 * for it; returning normally is success, throwing is failure and rolls that transaction back.
 *
 * <p>Must not commit, roll back or close {@link JdbcTransaction#connection()}.
 */
@FunctionalInterface
public interface MigrationAction {

  /** Does nothing. Used by the floor migration. */
  MigrationAction NONE = transaction -> {};

  void apply(JdbcTransaction transaction) throws Exception;
}
