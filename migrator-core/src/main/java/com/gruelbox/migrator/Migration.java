package com.gruelbox.migrator;

import lombok.Value;

/** A registered migration. See {@link MigrationRegistry}. */
@Value
public class Migration {
  String version;
  String name;
  MigrationAction up;
  MigrationAction down;

  MigrationAction action(Direction direction) {
    return direction == Direction.UP ? up : down;
  }
}
