package com.gruelbox.migrator;

/** The SQL dialects supported by {@link DefaultVersionStore}. */
public interface Dialect {

  String getName();

  /**
   * @return Format string for the DDL creating the versions table if it does not already exist.
   */
  String getCreateVersionTable();

  /**
   * @return Format string for the query returning the single greatest applied version.
   */
  String getFetchCurrentVersion();

  Dialect H2 =
      DefaultDialect.builder("H2")
          .createVersionTable(
              "CREATE TABLE IF NOT EXISTS {{table}} (\n"
                  + "    id BIGINT AUTO_INCREMENT PRIMARY KEY,\n"
                  + "    version VARCHAR NOT NULL,\n"
                  + "    name VARCHAR NOT NULL,\n"
                  + "    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL\n"
                  + ")")
          .build();

  Dialect POSTGRESQL_9 = DefaultDialect.builder("POSTGRESQL_9").build();

  Dialect MY_SQL_8 =
      DefaultDialect.builder("MY_SQL_8")
          .createVersionTable(
              "CREATE TABLE IF NOT EXISTS {{table}} (\n"
                  + "    id BIGINT AUTO_INCREMENT PRIMARY KEY,\n"
                  + "    version TEXT NOT NULL,\n"
                  + "    name TEXT NOT NULL,\n"
                  + "    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL\n"
                  + ")")
          .build();
}
