package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheck;
import static com.gruelbox.migrator.Utils.uncheckedly;

/**
 * Starts, commits and rolls back JDBC transactions on behalf of the migrator. Since JDBC is a
 * fundamentally blocking API, all methods block until the transaction has completed.
 *
 * <p>Applications with no existing transaction management can use {@link
 * SimpleTransactionManager}. Others should implement this interface over whatever they already
 * use, honouring the contract of {@link
 * #inTransactionReturnsThrows(ThrowingTransactionalSupplier)}.
 *
 * @param <TX> The transaction type
 */
public interface JdbcTransactionManager<TX extends JdbcTransaction> {

  /**
   * Should do any work necessary to start a (new) transaction, call {@code runnable} and then
   * either commit on success or rollback on failure.
   *
   * @param runnable Code which must be called while the transaction is active.
   */
  default void inTransaction(Runnable runnable) {
    uncheck(() -> inTransactionReturnsThrows(ThrowingTransactionalSupplier.fromRunnable(runnable)));
  }

  /**
   * Should do any work necessary to start a (new) transaction, call {@code work} and then either
   * commit on success or rollback on failure.
   *
   * @param work Code which must be called while the transaction is active.
   * @param <E> The exception type.
   * @throws E If any exception is thrown by {@code work}.
   */
  default <E extends Exception> void inTransactionThrows(ThrowingTransactionalWork<E, TX> work)
      throws E {
    inTransactionReturnsThrows(ThrowingTransactionalSupplier.fromWork(work));
  }

  /**
   * As {@link #inTransactionReturnsThrows(ThrowingTransactionalSupplier)}, but any checked
   * exception is rethrown unchecked.
   *
   * @param <T> The type returned.
   * @param work Code which must be called while the transaction is active.
   * @return The result of {@code work}.
   */
  default <T> T inTransactionReturns(ThrowingTransactionalSupplier<T, ?, TX> work) {
    return uncheckedly(() -> inTransactionReturnsThrows(work));
  }

  /**
   * Should do any work necessary to start a (new) transaction, call {@code work} and then either
   * commit on success or rollback on failure. A failure to commit must also result in a rollback
   * and be thrown to the caller. The underlying connection must be released on every path.
   *
   * @param <T> The type returned.
   * @param work Code which must be called while the transaction is active.
   * @param <E> The exception type.
   * @return The result of {@code work}.
   * @throws E If any exception is thrown by {@code work}.
   */
  <T, E extends Exception> T inTransactionReturnsThrows(
      ThrowingTransactionalSupplier<T, E, TX> work) throws E;
}
