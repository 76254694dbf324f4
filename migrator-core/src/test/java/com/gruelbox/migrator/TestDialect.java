package com.gruelbox.migrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TestDialect {

  @Test
  void builtInDialectsAreNamed() {
    assertEquals("H2", Dialect.H2.getName());
    assertEquals("POSTGRESQL_9", Dialect.POSTGRESQL_9.getName());
    assertEquals("MY_SQL_8", Dialect.MY_SQL_8.getName());
    assertEquals("H2", Dialect.H2.toString());
  }

  @Test
  void everyDialectTargetsTheConfiguredTable() {
    for (Dialect dialect : new Dialect[] {Dialect.H2, Dialect.POSTGRESQL_9, Dialect.MY_SQL_8}) {
      assertTrue(dialect.getCreateVersionTable().contains("{{table}}"), dialect.getName());
      assertTrue(dialect.getFetchCurrentVersion().contains("{{table}}"), dialect.getName());
    }
  }
}
