package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheck;

import java.sql.Connection;
import java.sql.SQLException;
import lombok.AllArgsConstructor;

/** The {@link JdbcTransaction} handed out by {@link SimpleTransactionManager}. */
@AllArgsConstructor
public class SimpleTransaction implements JdbcTransaction {

  private final Connection connection;

  @Override
  public final Connection connection() {
    return connection;
  }

  void commit() {
    uncheck(connection::commit);
  }

  void rollback() throws SQLException {
    connection.rollback();
  }

  @Override
  public String toString() {
    return "SimpleTransaction(" + connection + ")";
  }
}
