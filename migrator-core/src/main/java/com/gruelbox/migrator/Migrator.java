package com.gruelbox.migrator;

import com.gruelbox.migrator.jdbc.JdbcTransaction;
import com.gruelbox.migrator.jdbc.JdbcTransactionManager;
import com.gruelbox.migrator.jdbc.SimpleTransactionManager;
import java.io.Writer;
import java.util.List;

/**
 * Applies and reverts the migrations in a {@link MigrationRegistry}, keeping track of them in a
 * {@link VersionStore}.
 *
 * <p>Usage:
 *
 * <pre>Migrator migrator = Migrator.builder()
 *   .transactionManager(SimpleTransactionManager.fromDataSource(dataSource))
 *   .registry(registry)
 *   .dialect(Dialect.POSTGRESQL_9)
 *   .build();
 * migrator.migrate();</pre>
 *
 * <p>Runs are single-threaded and blocking. Nothing prevents two migrators running against the
 * same database at once, and doing so is unsafe.
 */
public interface Migrator {

  /**
   * @return A builder for creating a new instance of {@link Migrator}.
   */
  static MigratorBuilder builder() {
    return MigratorImpl.builder();
  }

  /**
   * Brings the database to the latest registered version. Equivalent to {@code migrate(null)}.
   *
   * @return The plan that was executed.
   * @throws MigrationFailedException If any migration fails.
   */
  MigrationPlan migrate();

  /**
   * Brings the database to the state of the target version, applying migrations in ascending order
   * or reverting them in descending order. Each migration runs in its own transaction, together
   * with the update to the version store.
   *
   * <p>The run stops at the first failure. Its transaction is rolled back, but migrations that
   * committed earlier in the run are left in place; re-running with the same target picks up where
   * the failed run left off. Running again with the target already reached does nothing.
   *
   * @param target The version to reach, which stays applied when migrating down. Null or empty
   *     means the latest registered version, and {@link MigrationRegistry#FLOOR_VERSION} reverts
   *     everything.
   * @return The plan that was executed.
   * @throws MigrationFailedException If any migration fails.
   * @throws IllegalArgumentException If the target sorts before {@link
   *     MigrationRegistry#FLOOR_VERSION}.
   */
  MigrationPlan migrate(String target);

  /**
   * @return Every registered migration in version order, flagged as applied or not.
   */
  List<MigrationStatus> status();

  /**
   * Writes {@link #status()} as a checklist, one line per migration, e.g. {@code [x]
   * 20200101T000000Z Create users}.
   *
   * @param writer The writer to which the checklist is written.
   */
  void writeStatus(Writer writer);

  abstract class MigratorBuilder {

    protected JdbcTransactionManager<? extends JdbcTransaction> transactionManager;
    protected MigrationRegistry registry;
    protected Dialect dialect;
    protected String tableName;
    protected VersionStore versionStore;

    protected MigratorBuilder() {}

    /**
     * @param transactionManager Starts, commits and rolls back the transactions migrations run in.
     *     {@link SimpleTransactionManager} will do if the application has no transaction
     *     management of its own. Required.
     * @return Builder.
     */
    public MigratorBuilder transactionManager(
        JdbcTransactionManager<? extends JdbcTransaction> transactionManager) {
      this.transactionManager = transactionManager;
      return this;
    }

    /**
     * @param registry The migrations. Required.
     * @return Builder.
     */
    public MigratorBuilder registry(MigrationRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * @param dialect The database dialect used by the default {@link VersionStore}. Required
     *     unless {@link #versionStore(VersionStore)} is given.
     * @return Builder.
     */
    public MigratorBuilder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * @param tableName The name of the table used by the default {@link VersionStore}. Defaults to
     *     {@code versions}.
     * @return Builder.
     */
    public MigratorBuilder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * @param versionStore Overrides the default {@link DefaultVersionStore}, in which case {@link
     *     #dialect(Dialect)} and {@link #tableName(String)} are ignored.
     * @return Builder.
     */
    public MigratorBuilder versionStore(VersionStore versionStore) {
      this.versionStore = versionStore;
      return this;
    }

    /**
     * Creates and validates the instance.
     *
     * @return The migrator.
     * @throws IllegalArgumentException If the configuration is invalid.
     */
    public abstract Migrator build();
  }
}
