package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheck;
import static com.gruelbox.migrator.Utils.uncheckedly;

import com.gruelbox.migrator.Utils;
import com.gruelbox.migrator.Validatable;
import com.gruelbox.migrator.Validator;
import java.sql.Connection;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class SimpleTransactionManagerImpl implements SimpleTransactionManager, Validatable {

  private final JdbcConnectionProvider connectionProvider;

  private SimpleTransactionManagerImpl(JdbcConnectionProvider connectionProvider) {
    this.connectionProvider = connectionProvider;
  }

  @Override
  public void validate(Validator validator) {
    validator.valid("connectionProvider", connectionProvider);
  }

  @Override
  public <T, E extends Exception> T inTransactionReturnsThrows(
      ThrowingTransactionalSupplier<T, E, SimpleTransaction> work) throws E {
    return withTransaction(atx -> processAndCommitOrRollback(work, atx));
  }

  private <T, E extends Exception> T processAndCommitOrRollback(
      ThrowingTransactionalSupplier<T, E, SimpleTransaction> work, SimpleTransaction transaction)
      throws E {
    try {
      log.debug("Processing work");
      T result = work.doWork(transaction);
      log.debug("Committing transaction");
      transaction.commit();
      return result;
    } catch (Exception e) {
      log.warn(
          "Exception in transactional block ({}). Rolling back. See later messages for detail",
          Utils.describe(e));
      Utils.safelyRun("rolling back", transaction::rollback);
      throw e;
    }
  }

  private <T, E extends Exception> T withTransaction(
      ThrowingTransactionalSupplier<T, E, SimpleTransaction> work) throws E {
    Connection connection = connectionProvider.obtainConnection();
    try {
      log.debug("Got connection {}", connection);
      boolean autoCommit = uncheckedly(connection::getAutoCommit);
      if (autoCommit) {
        log.debug("Setting auto-commit false");
        uncheck(() -> connection.setAutoCommit(false));
      }
      try {
        return work.doWork(new SimpleTransaction(connection));
      } finally {
        if (autoCommit) {
          Utils.safelyRun("restoring auto-commit", () -> connection.setAutoCommit(true));
        }
      }
    } finally {
      Utils.safelyRun("closing connection", connection::close);
    }
  }

  static final class Builder implements SimpleTransactionManager.SimpleTransactionManagerBuilder {
    private JdbcConnectionProvider connectionProvider;

    Builder() {}

    @Override
    public Builder connectionProvider(JdbcConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    @Override
    public SimpleTransactionManagerImpl build() {
      SimpleTransactionManagerImpl impl = new SimpleTransactionManagerImpl(connectionProvider);
      new Validator().validate(impl);
      return impl;
    }

    @Override
    public String toString() {
      return "SimpleTransactionManagerImpl.Builder(connectionProvider=" + connectionProvider + ")";
    }
  }
}
