package com.gentoro.clirunner.exception;

/** A component was used before it was initialized or after it was closed. */
public class StateException extends CliRunnerException {
  public StateException(String message) {
    super(CliRunnerErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(CliRunnerErrorCode.STATE_ERROR, message, cause);
  }
}
