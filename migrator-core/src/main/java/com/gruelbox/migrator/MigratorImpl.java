package com.gruelbox.migrator;

import static com.gruelbox.migrator.Utils.uncheckedly;
import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

import com.gruelbox.migrator.jdbc.JdbcTransaction;
import com.gruelbox.migrator.jdbc.JdbcTransactionManager;
import com.gruelbox.migrator.jdbc.ThrowingTransactionalSupplier;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Set;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class MigratorImpl implements Migrator, Validatable {

  private final JdbcTransactionManager<? extends JdbcTransaction> transactionManager;
  private final MigrationRegistry registry;
  private final VersionStore versionStore;

  static MigratorBuilder builder() {
    return new MigratorBuilderImpl();
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("transactionManager", transactionManager);
    validator.notNull("registry", registry);
    validator.valid("versionStore", versionStore);
  }

  @Override
  public MigrationPlan migrate() {
    return migrate(null);
  }

  @Override
  public MigrationPlan migrate(String target) {
    if (target != null
        && !target.isEmpty()
        && target.compareTo(MigrationRegistry.FLOOR_VERSION) < 0) {
      throw new IllegalArgumentException(
          "Target " + target + " sorts before " + MigrationRegistry.FLOOR_VERSION);
    }
    ensureSchema();
    String current = currentVersion();
    MigrationPlan plan = MigrationPlanner.plan(registry.sortedVersions(), current, target);
    if (plan.isEmpty()) {
      log.info("Database is at {}. No migrations to run for target {}", current, plan.getTarget());
      return plan;
    }
    log.info(
        "Migrating {} from {} to {}: {}",
        plan.getDirection(),
        current,
        plan.getTarget(),
        plan.getVersions());
    for (String version : plan.getVersions()) {
      execute(registry.require(version), plan.getDirection());
    }
    log.info("Migrated {} to {}", plan.getDirection(), plan.getTarget());
    return plan;
  }

  @Override
  public List<MigrationStatus> status() {
    ensureSchema();
    Set<String> applied =
        uncheckedly(() -> inTransaction(versionStore::listApplied)).stream()
            .map(AppliedVersion::getVersion)
            .collect(toSet());
    return registry.sortedVersions().stream()
        .map(
            version ->
                new MigrationStatus(
                    version, registry.require(version).getName(), applied.contains(version)))
        .collect(toList());
  }

  @Override
  public void writeStatus(Writer writer) {
    PrintWriter printWriter = new PrintWriter(writer);
    status().forEach(line -> printWriter.print(line + "\n"));
    printWriter.flush();
  }

  private void ensureSchema() {
    try {
      inTransaction(
          tx -> {
            versionStore.ensureSchema(tx);
            return null;
          });
    } catch (Exception e) {
      log.error("Error creating version table", e);
      Utils.uncheckAndThrow(e);
    }
  }

  private String currentVersion() {
    try {
      String current =
          inTransaction(versionStore::currentVersion).orElse(MigrationRegistry.FLOOR_VERSION);
      if (!registry.contains(current)) {
        log.warn("Current version {} is not registered", current);
      }
      return current;
    } catch (Exception e) {
      log.error("Error querying current version", e);
      return Utils.uncheckAndThrow(e);
    }
  }

  private void execute(Migration migration, Direction direction) {
    String version = migration.getVersion();
    log.info(
        "{} migration {}: {}",
        direction == Direction.UP ? "Applying" : "Reverting",
        version,
        migration.getName());
    try {
      inTransaction(
          tx -> {
            migration.action(direction).apply(tx);
            if (direction == Direction.UP) {
              versionStore.recordApplied(tx, version, migration.getName());
            } else {
              versionStore.recordReverted(tx, version);
            }
            return null;
          });
    } catch (Exception e) {
      log.error("Error migrating {} {}. Run aborted", direction, version, e);
      throw new MigrationFailedException(version, direction, e);
    }
  }

  private <T, E extends Exception> T inTransaction(
      ThrowingTransactionalSupplier<T, E, JdbcTransaction> work) throws E {
    return inTransaction(transactionManager, work);
  }

  private static <T, E extends Exception, TX extends JdbcTransaction> T inTransaction(
      JdbcTransactionManager<TX> transactionManager,
      ThrowingTransactionalSupplier<T, E, JdbcTransaction> work)
      throws E {
    return transactionManager.inTransactionReturnsThrows(work::doWork);
  }

  static class MigratorBuilderImpl extends MigratorBuilder {

    MigratorBuilderImpl() {
      super();
    }

    @Override
    public MigratorImpl build() {
      VersionStore store = Utils.firstNonNull(versionStore, this::defaultVersionStore);
      MigratorImpl impl = new MigratorImpl(transactionManager, registry, store);
      new Validator().validate(impl);
      return impl;
    }

    private DefaultVersionStore defaultVersionStore() {
      var storeBuilder = DefaultVersionStore.builder().dialect(dialect);
      if (tableName != null) {
        storeBuilder.tableName(tableName);
      }
      return storeBuilder.build();
    }
  }
}
