package com.gruelbox.migrator.jdbc;

@FunctionalInterface
public interface ThrowingTransactionalWork<E extends Exception, TX extends JdbcTransaction> {

  void doWork(TX transaction) throws E;
}
