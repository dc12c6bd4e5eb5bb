package com.gentoro.clirunner.exception;

/** Unknown job id or connector name. */
public class NotFoundException extends CliRunnerException {
  public NotFoundException(String message) {
    super(CliRunnerErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(CliRunnerErrorCode.NOT_FOUND, message, cause);
  }
}
