package com.gruelbox.migrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Works out which migrations a run executes, and in which direction.
 *
 * <p>Going up from {@code current} to {@code target} applies every registered version in {@code
 * (current, target]}, lowest first. Going down reverts every registered version in {@code (target,
 * current]}, highest first. The target itself stays applied when going down, and asking for the
 * current version again yields an empty plan.
 */
public final class MigrationPlanner {

  private MigrationPlanner() {}

  /**
   * @param sortedVersions Every registered version, ascending.
   * @param current The greatest applied version.
   * @param target The version to reach. Null or empty means the greatest registered version.
   * @return The plan.
   */
  public static MigrationPlan plan(List<String> sortedVersions, String current, String target) {
    if (target == null || target.isEmpty()) {
      if (sortedVersions.isEmpty()) {
        throw new IllegalArgumentException("No versions registered");
      }
      target = sortedVersions.get(sortedVersions.size() - 1);
    }
    Direction direction = current.compareTo(target) > 0 ? Direction.DOWN : Direction.UP;
    List<String> selected = new ArrayList<>();
    for (String version : sortedVersions) {
      if (shouldMigrate(version, current, target, direction)) {
        selected.add(version);
      }
    }
    if (direction == Direction.DOWN) {
      Collections.reverse(selected);
    }
    return new MigrationPlan(direction, List.copyOf(selected), current, target);
  }

  private static boolean shouldMigrate(
      String version, String current, String target, Direction direction) {
    if (direction == Direction.DOWN) {
      return version.compareTo(current) <= 0 && version.compareTo(target) > 0;
    }
    return version.compareTo(current) > 0 && version.compareTo(target) <= 0;
  }
}
