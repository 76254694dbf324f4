package com.gruelbox.migrator;

import lombok.Value;

/** One line of {@link Migrator#status()}. */
@Value
public class MigrationStatus {
  String version;
  String name;
  boolean applied;

  @Override
  public String toString() {
    return "[" + (applied ? "x" : " ") + "] " + version + " " + name;
  }
}
