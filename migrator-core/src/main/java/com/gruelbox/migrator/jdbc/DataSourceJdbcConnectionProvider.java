package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheckedly;

import java.sql.Connection;
import javax.sql.DataSource;
import lombok.Builder;

/**
 * A {@link JdbcConnectionProvider} which requests connections from a {@link DataSource}. This is
 * suitable for applications using connection pools or container-provided JDBC.
 *
 * <p>Usage:
 *
 * <pre>JdbcConnectionProvider provider = DataSourceJdbcConnectionProvider.builder()
 *   .dataSource(ds)
 *   .build()</pre>
 */
@Builder
final class DataSourceJdbcConnectionProvider implements JdbcConnectionProvider {

  private final DataSource dataSource;

  @Override
  public Connection obtainConnection() {
    return uncheckedly(dataSource::getConnection);
  }
}
