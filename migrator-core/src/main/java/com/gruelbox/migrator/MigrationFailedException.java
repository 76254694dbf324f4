package com.gruelbox.migrator;

import lombok.Getter;

/**
 * Thrown when a migration run stops because one migration could not be applied or reverted. The
 * failed migration's transaction has been rolled back. Migrations earlier in the same run remain
 * committed, so the database may be part-way towards the target.
 */
@Getter
public class MigrationFailedException extends RuntimeException {

  private final String version;
  private final Direction direction;

  MigrationFailedException(String version, Direction direction, Throwable cause) {
    super(
        "Failed to "
            + (direction == Direction.UP ? "apply" : "revert")
            + " migration "
            + version
            + " ("
            + Utils.describe(cause)
            + ")",
        cause);
    this.version = version;
    this.direction = direction;
  }
}
