package com.gruelbox.migrator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gruelbox.migrator.jdbc.SimpleTransactionManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

abstract class AbstractVersionStoreTest {

  private static final String A = "20200101T000000Z";
  private static final String B = "20200201T000000Z";
  private static final String C = "20200301T000000Z";

  private HikariDataSource dataSource;
  private SimpleTransactionManager txManager;

  protected abstract Dialect dialect();

  protected abstract String driverClassName();

  protected abstract String url();

  protected abstract String user();

  protected abstract String password();

  protected DefaultVersionStore store() {
    return VersionStore.forDialect(dialect());
  }

  @BeforeEach
  void beforeEach() throws SQLException {
    HikariConfig config = new HikariConfig();
    config.setDriverClassName(driverClassName());
    config.setJdbcUrl(url());
    config.setUsername(user());
    config.setPassword(password());
    dataSource = new HikariDataSource(config);
    txManager = SimpleTransactionManager.fromDataSource(dataSource);
    dropTables();
    txManager.inTransactionThrows(store()::ensureSchema);
  }

  @AfterEach
  void afterEach() throws SQLException {
    dropTables();
    dataSource.close();
  }

  private void dropTables() throws SQLException {
    txManager.inTransactionThrows(
        tx -> {
          try (Statement s = tx.connection().createStatement()) {
            s.execute("DROP TABLE IF EXISTS versions");
            s.execute("DROP TABLE IF EXISTS schema_versions");
          }
        });
  }

  @Test
  void ensureSchemaIsIdempotent() throws SQLException {
    txManager.inTransactionThrows(store()::ensureSchema);
    txManager.inTransactionThrows(tx -> store().recordApplied(tx, A, "A"));
    txManager.inTransactionThrows(store()::ensureSchema);
    assertThat(versions(listApplied()), contains(A));
  }

  @Test
  void currentVersionWithNoRows() throws SQLException {
    assertEquals(Optional.empty(), txManager.inTransactionReturnsThrows(store()::currentVersion));
    assertThat(listApplied(), empty());
  }

  @Test
  void recordAndList() throws SQLException {
    txManager.inTransactionThrows(
        tx -> {
          store().recordApplied(tx, B, "Second");
          store().recordApplied(tx, A, "First");
        });
    txManager.inTransactionThrows(tx -> store().recordApplied(tx, C, "Third"));

    List<AppliedVersion> applied = listApplied();
    assertThat(versions(applied), contains(A, B, C));
    assertEquals("First", applied.get(0).getName());
    assertEquals("Second", applied.get(1).getName());
    assertEquals("Third", applied.get(2).getName());
    applied.forEach(it -> assertThat(it.getCreatedAt(), notNullValue()));
    assertThat(applied.get(0).getId(), not(applied.get(1).getId()));
    assertEquals(Optional.of(C), txManager.inTransactionReturnsThrows(store()::currentVersion));
  }

  @Test
  void recordReverted() throws SQLException {
    txManager.inTransactionThrows(
        tx -> {
          store().recordApplied(tx, A, "A");
          store().recordApplied(tx, B, "B");
          store().recordApplied(tx, C, "C");
        });
    txManager.inTransactionThrows(tx -> store().recordReverted(tx, C));
    assertThat(versions(listApplied()), contains(A, B));
    assertEquals(Optional.of(B), txManager.inTransactionReturnsThrows(store()::currentVersion));
  }

  @Test
  void revertingUnknownVersionIsHarmless() throws SQLException {
    txManager.inTransactionThrows(tx -> store().recordApplied(tx, A, "A"));
    txManager.inTransactionThrows(tx -> store().recordReverted(tx, B));
    assertThat(versions(listApplied()), contains(A));
  }

  @Test
  void rollbackDiscardsRecord() throws SQLException {
    txManager.inTransactionThrows(tx -> store().recordApplied(tx, A, "A"));
    assertThrows(
        IllegalStateException.class,
        () ->
            txManager.inTransactionThrows(
                tx -> {
                  store().recordApplied(tx, B, "B");
                  throw new IllegalStateException("Rolled back");
                }));
    assertThat(versions(listApplied()), contains(A));
  }

  @Test
  void customTableName() throws SQLException {
    DefaultVersionStore custom =
        DefaultVersionStore.builder().dialect(dialect()).tableName("schema_versions").build();
    txManager.inTransactionThrows(custom::ensureSchema);
    txManager.inTransactionThrows(tx -> custom.recordApplied(tx, A, "A"));
    assertEquals(Optional.of(A), txManager.inTransactionReturnsThrows(custom::currentVersion));
    assertThat(listApplied(), empty());
  }

  private List<AppliedVersion> listApplied() throws SQLException {
    return txManager.inTransactionReturnsThrows(store()::listApplied);
  }

  private static List<String> versions(List<AppliedVersion> applied) {
    return applied.stream().map(AppliedVersion::getVersion).collect(Collectors.toList());
  }
}
