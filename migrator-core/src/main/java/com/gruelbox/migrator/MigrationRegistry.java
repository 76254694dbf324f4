package com.gruelbox.migrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * The full set of migrations known to the application, keyed and ordered by version.
 *
 * <p>Versions are compared as plain strings, so the naming scheme must make lexicographic order
 * match the intended order of application. Fixed-width, zero-padded UTC timestamps such as {@code
 * 20200101T000000Z} do; unpadded numbers such as {@code 9} and {@code 10} do not.
 *
 * <p>Every registry contains the floor migration {@link #FLOOR_VERSION}, a no-op which sorts before
 * any real version and is the target to use when reverting everything.
 *
 * <p>Usage:
 *
 * <pre>MigrationRegistry registry = MigrationRegistry.builder()
 *   .register("20200101T000000Z", "Create users", up, down)
 *   .register("20200201T000000Z", "Add email to users", up2, down2)
 *   .build();</pre>
 *
 * <p>Instances are immutable.
 */
@Slf4j
public final class MigrationRegistry {

  public static final String FLOOR_VERSION = "00010101T000000Z";
  public static final String FLOOR_NAME = "nil";

  private final TreeMap<String, Migration> migrations;

  private MigrationRegistry(TreeMap<String, Migration> migrations) {
    this.migrations = migrations;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return All registered versions, floor included, in ascending order.
   */
  public List<String> sortedVersions() {
    return List.copyOf(migrations.keySet());
  }

  /**
   * @return The greatest registered version. This is {@link #FLOOR_VERSION} if nothing else was
   *     registered.
   */
  public String latestVersion() {
    return migrations.lastKey();
  }

  public Optional<Migration> get(String version) {
    return Optional.ofNullable(migrations.get(version));
  }

  public boolean contains(String version) {
    return migrations.containsKey(version);
  }

  Migration require(String version) {
    return get(version)
        .orElseThrow(() -> new IllegalStateException("No migration registered for " + version));
  }

  /** Collects registrations. Problems are recorded rather than thrown until {@link #build()}. */
  public static final class Builder {

    private final Map<String, Migration> migrations = new TreeMap<>();
    private final List<RegistrationProblem> problems = new ArrayList<>();

    private Builder() {
      migrations.put(
          FLOOR_VERSION,
          new Migration(FLOOR_VERSION, FLOOR_NAME, MigrationAction.NONE, MigrationAction.NONE));
    }

    /**
     * Makes a migration available.
     *
     * @param version The version. Must be unique and sort correctly as a string.
     * @param name A human-readable description, stored alongside the version when applied.
     * @param up Applies the migration.
     * @param down Reverts the migration.
     * @return This builder.
     */
    public Builder register(
        String version, String name, MigrationAction up, MigrationAction down) {
      int problemCount = problems.size();
      if (version == null || version.isBlank()) {
        problems.add(new RegistrationProblem(version, "version may not be blank"));
      } else if (migrations.containsKey(version)) {
        problems.add(new RegistrationProblem(version, "registered twice"));
      } else if (version.compareTo(FLOOR_VERSION) < 0) {
        problems.add(new RegistrationProblem(version, "must sort after " + FLOOR_VERSION));
      }
      if (up == null) {
        problems.add(new RegistrationProblem(version, "up action is required"));
      }
      if (down == null) {
        problems.add(new RegistrationProblem(version, "down action is required"));
      }
      if (problems.size() == problemCount) {
        migrations.put(version, new Migration(version, name == null ? "" : name, up, down));
      }
      return this;
    }

    /**
     * @return Every problem found in the registrations so far. Empty if they are all valid.
     */
    public List<RegistrationProblem> validate() {
      return Collections.unmodifiableList(new ArrayList<>(problems));
    }

    /**
     * @return The registry.
     * @throws MigrationRegistrationException If {@link #validate()} reports any problems.
     */
    public MigrationRegistry build() {
      if (!problems.isEmpty()) {
        problems.forEach(problem -> log.error("Invalid migration registration {}", problem));
        throw new MigrationRegistrationException(problems);
      }
      log.debug("Registered {} migrations", migrations.size() - 1);
      return new MigrationRegistry(new TreeMap<>(migrations));
    }
  }
}
