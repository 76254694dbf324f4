package com.gruelbox.migrator;

import java.util.concurrent.Callable;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility methods used by the migrator. These are very firmly {@link NotApi}. Don't use them in
 * your code as they may be modified or removed without warning.
 */
@Slf4j
@NotApi
public class Utils {

  private Utils() {}

  @SuppressWarnings({"SameParameterValue", "UnusedReturnValue"})
  public static boolean safelyRun(String gerund, ThrowingRunnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  public static void uncheck(ThrowingRunnable runnable) {
    try {
      runnable.run();
    } catch (Exception e) {
      uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckedly(Callable<T> runnable) {
    try {
      return runnable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }

  public static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  public static String describe(Throwable e) {
    return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : (" - " + e.getMessage()));
  }
}
