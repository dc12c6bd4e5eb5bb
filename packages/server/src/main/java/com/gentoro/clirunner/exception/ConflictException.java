package com.gentoro.clirunner.exception;

/** The requested mutation is not valid in the current state of the target. */
public class ConflictException extends CliRunnerException {
  public ConflictException(String message) {
    super(CliRunnerErrorCode.CONFLICT, message);
  }

  public ConflictException(String message, Throwable cause) {
    super(CliRunnerErrorCode.CONFLICT, message, cause);
  }
}
