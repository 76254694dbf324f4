package com.gruelbox.migrator;

/** A checked {@link Exception} rethrown as unchecked, typically a {@link java.sql.SQLException}. */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
