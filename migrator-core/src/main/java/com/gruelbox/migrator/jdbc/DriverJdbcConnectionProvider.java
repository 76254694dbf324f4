package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheckedly;

import com.gruelbox.migrator.Validatable;
import com.gruelbox.migrator.Validator;
import java.sql.Connection;
import java.sql.DriverManager;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link JdbcConnectionProvider} which requests connections directly from {@link DriverManager}.
 *
 * <p>Fine for a migration run, which opens a handful of connections and then exits, but there is no
 * pooling.
 *
 * <p>Usage:
 *
 * <pre>JdbcConnectionProvider provider = DriverJdbcConnectionProvider.builder()
 *   .driverClassName("org.postgresql.Driver")
 *   .url(myJdbcUrl)
 *   .user("myusername")
 *   .password("mypassword")
 *   .build()</pre>
 */
@Builder
@Slf4j
final class DriverJdbcConnectionProvider implements JdbcConnectionProvider, Validatable {

  private final String driverClassName;
  private final String url;
  private final String user;
  private final String password;

  private volatile boolean initialized;

  @Override
  public Connection obtainConnection() {
    return uncheckedly(
        () -> {
          if (!initialized) {
            synchronized (this) {
              log.debug("Initialising {}", driverClassName);
              Class.forName(driverClassName);
              initialized = true;
            }
          }
          log.debug("Opening connection to {}", url);
          return DriverManager.getConnection(url, user, password);
        });
  }

  @Override
  public void validate(Validator validator) {
    validator.notBlank("driverClassName", driverClassName);
    validator.notBlank("url", url);
    validator.notNull("user", user);
    validator.notNull("password", password);
  }
}
