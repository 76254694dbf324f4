package com.gruelbox.migrator;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
class DefaultDialect implements Dialect {

  static Builder builder(String name) {
    return new Builder(name);
  }

  @Getter private final String name;
  @Getter private final String createVersionTable;
  @Getter private final String fetchCurrentVersion;

  @Override
  public String toString() {
    return name;
  }

  @Setter
  @Accessors(fluent = true)
  static final class Builder {
    private final String name;
    private String createVersionTable =
        "CREATE TABLE IF NOT EXISTS {{table}} (\n"
            + "    id BIGSERIAL PRIMARY KEY,\n"
            + "    version TEXT NOT NULL,\n"
            + "    name TEXT NOT NULL,\n"
            + "    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL\n"
            + ")";
    private String fetchCurrentVersion =
        "SELECT version FROM {{table}} ORDER BY version DESC LIMIT 1";

    Builder(String name) {
      this.name = name;
    }

    Dialect build() {
      return new DefaultDialect(name, createVersionTable, fetchCurrentVersion);
    }
  }
}
