package com.gruelbox.migrator.jdbc;

@FunctionalInterface
public interface ThrowingTransactionalSupplier<
    T, E extends Exception, TX extends JdbcTransaction> {

  static <F extends Exception, G extends JdbcTransaction>
      ThrowingTransactionalSupplier<Void, F, G> fromRunnable(Runnable runnable) {
    return transaction -> {
      runnable.run();
      return null;
    };
  }

  static <F extends Exception, G extends JdbcTransaction>
      ThrowingTransactionalSupplier<Void, F, G> fromWork(ThrowingTransactionalWork<F, G> work) {
    return transaction -> {
      work.doWork(transaction);
      return null;
    };
  }

  T doWork(TX transaction) throws E;
}
