package com.gruelbox.migrator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TestMigrationPlanner {

  private static final String FLOOR = MigrationRegistry.FLOOR_VERSION;
  private static final String A = "20200101T000000Z";
  private static final String B = "20200201T000000Z";
  private static final String C = "20200301T000000Z";
  private static final List<String> VERSIONS = List.of(FLOOR, A, B, C);

  @Test
  void emptyTargetMeansLatest() {
    MigrationPlan plan = MigrationPlanner.plan(VERSIONS, FLOOR, "");
    assertEquals(Direction.UP, plan.getDirection());
    assertEquals(C, plan.getTarget());
    assertThat(plan.getVersions(), contains(A, B, C));
  }

  @Test
  void nullTargetMeansLatest() {
    MigrationPlan plan = MigrationPlanner.plan(VERSIONS, A, null);
    assertThat(plan.getVersions(), contains(B, C));
  }

  @Test
  void upIncludesTargetButNotCurrent() {
    MigrationPlan plan = MigrationPlanner.plan(VERSIONS, A, C);
    assertEquals(Direction.UP, plan.getDirection());
    assertThat(plan.getVersions(), contains(B, C));
  }

  @Test
  void downIsDescendingAndKeepsTarget() {
    MigrationPlan plan = MigrationPlanner.plan(VERSIONS, C, A);
    assertEquals(Direction.DOWN, plan.getDirection());
    assertThat(plan.getVersions(), contains(C, B));
  }

  @Test
  void downToFloorRevertsEverything() {
    MigrationPlan plan = MigrationPlanner.plan(VERSIONS, C, FLOOR);
    assertEquals(Direction.DOWN, plan.getDirection());
    assertThat(plan.getVersions(), contains(C, B, A));
  }

  @Test
  void sameVersionIsEmpty() {
    for (String version : VERSIONS) {
      MigrationPlan plan = MigrationPlanner.plan(VERSIONS, version, version);
      assertTrue(plan.isEmpty(), version);
      assertEquals(Direction.UP, plan.getDirection());
    }
  }

  @Test
  void unregisteredTargetActsAsBound() {
    MigrationPlan up = MigrationPlanner.plan(VERSIONS, FLOOR, "20200215T000000Z");
    assertThat(up.getVersions(), contains(A, B));
    MigrationPlan down = MigrationPlanner.plan(VERSIONS, C, "20200115T000000Z");
    assertThat(down.getVersions(), contains(C, B));
  }

  @Test
  void noVersionsAndNoTarget() {
    assertThrows(
        IllegalArgumentException.class, () -> MigrationPlanner.plan(List.of(), FLOOR, null));
  }

  @Test
  void randomisedIntervals() {
    Random random = new Random(20200101L);
    for (int run = 0; run < 500; run++) {
      TreeSet<String> registered = new TreeSet<>();
      registered.add(FLOOR);
      int count = random.nextInt(12);
      for (int i = 0; i < count; i++) {
        registered.add(randomVersion(random));
      }
      List<String> sorted = new ArrayList<>(registered);
      String current = pick(random, sorted);
      String target = pick(random, sorted);

      MigrationPlan plan = MigrationPlanner.plan(sorted, current, target);

      if (current.compareTo(target) <= 0) {
        assertEquals(Direction.UP, plan.getDirection());
        List<String> expected =
            sorted.stream()
                .filter(v -> v.compareTo(current) > 0 && v.compareTo(target) <= 0)
                .collect(Collectors.toList());
        assertThat(plan.getVersions(), equalTo(expected));
        assertStrictlyOrdered(plan.getVersions(), Comparator.naturalOrder());
      } else {
        assertEquals(Direction.DOWN, plan.getDirection());
        List<String> expected =
            sorted.stream()
                .filter(v -> v.compareTo(target) > 0 && v.compareTo(current) <= 0)
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        assertThat(plan.getVersions(), equalTo(expected));
        assertStrictlyOrdered(plan.getVersions(), Comparator.reverseOrder());
      }
      if (current.equals(target)) {
        assertThat(plan.getVersions(), empty());
      }
    }
  }

  private static String randomVersion(Random random) {
    return String.format(
        "%04d%02d%02dT%02d%02d00Z",
        2000 + random.nextInt(30),
        1 + random.nextInt(12),
        1 + random.nextInt(28),
        random.nextInt(24),
        random.nextInt(60));
  }

  private static String pick(Random random, List<String> sorted) {
    if (random.nextInt(4) == 0) {
      return randomVersion(random);
    }
    return sorted.get(random.nextInt(sorted.size()));
  }

  private static void assertStrictlyOrdered(List<String> versions, Comparator<String> order) {
    for (int i = 1; i < versions.size(); i++) {
      assertTrue(order.compare(versions.get(i - 1), versions.get(i)) < 0, versions.toString());
    }
  }
}
