package com.gruelbox.migrator.jdbc;

import java.sql.Connection;

/** Represents a transaction in JDBC-land. */
public interface JdbcTransaction {

  /**
   * @return The connection on which the transaction is running. Client code must not commit, roll
   *     back or close it; that is the job of the {@link JdbcTransactionManager}.
   */
  Connection connection();
}
