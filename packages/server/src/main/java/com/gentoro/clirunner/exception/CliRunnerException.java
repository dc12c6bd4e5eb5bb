package com.gentoro.clirunner.exception;

/** Base class for all runtime exceptions raised by the CLI runner. */
public class CliRunnerException extends RuntimeException {
  private final CliRunnerErrorCode code;

  public CliRunnerException(CliRunnerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public CliRunnerException(CliRunnerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public CliRunnerErrorCode getCode() {
    return code;
  }
}
