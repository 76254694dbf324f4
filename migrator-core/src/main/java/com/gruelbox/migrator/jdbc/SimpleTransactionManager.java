package com.gruelbox.migrator.jdbc;

import com.gruelbox.migrator.Validator;
import javax.sql.DataSource;

/**
 * A simple {@link JdbcTransactionManager} implementation suitable for applications with no existing
 * transaction management. Every transaction gets its own connection from a {@link
 * JdbcConnectionProvider}, with auto-commit disabled for the duration of the transaction.
 */
public interface SimpleTransactionManager extends JdbcTransactionManager<SimpleTransaction> {

  /**
   * Creates a simple transaction manager which uses the specified {@link DataSource} to source
   * connections. A new connection is requested for each transaction.
   *
   * @param dataSource The data source.
   * @return The transaction manager.
   */
  static SimpleTransactionManager fromDataSource(DataSource dataSource) {
    return builder()
        .connectionProvider(
            DataSourceJdbcConnectionProvider.builder().dataSource(dataSource).build())
        .build();
  }

  /**
   * Creates a simple transaction manager which uses the specified connection details to request a
   * new connection from the {@link java.sql.DriverManager} every time a new transaction starts.
   *
   * @param driverClass The driver class name (e.g. {@code org.postgresql.Driver}).
   * @param url The JDBC url.
   * @param username The username.
   * @param password The password.
   * @return The transaction manager.
   */
  static SimpleTransactionManager fromConnectionDetails(
      String driverClass, String url, String username, String password) {
    DriverJdbcConnectionProvider connectionProvider =
        DriverJdbcConnectionProvider.builder()
            .driverClassName(driverClass)
            .url(url)
            .user(username)
            .password(password)
            .build();
    new Validator().validate(connectionProvider);
    return builder().connectionProvider(connectionProvider).build();
  }

  static SimpleTransactionManagerBuilder builder() {
    return new SimpleTransactionManagerImpl.Builder();
  }

  interface SimpleTransactionManagerBuilder {
    SimpleTransactionManagerBuilder connectionProvider(JdbcConnectionProvider connectionProvider);

    SimpleTransactionManager build();
  }
}
