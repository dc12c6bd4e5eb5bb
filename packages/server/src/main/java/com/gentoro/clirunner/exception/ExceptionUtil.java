package com.gentoro.clirunner.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Extract a user-facing message from a throwable, without any stack trace information. Messages
   * of {@link CliRunnerException}s are returned as-is; other throwables are prefixed with their
   * simple class name.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String className = t.getClass().getSimpleName();
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      return className;
    }
    if (t instanceof CliRunnerException) {
      return message;
    }
    return className + ": " + message;
  }

  public static CliRunnerException rethrowIfUnchecked(
      Throwable t, Function<Throwable, CliRunnerException> supplier) {
    if (t instanceof CliRunnerException) {
      return (CliRunnerException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
