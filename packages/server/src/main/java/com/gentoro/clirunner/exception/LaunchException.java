package com.gentoro.clirunner.exception;

/** The external process, or the task supervising it, could not be started. */
public class LaunchException extends CliRunnerException {
  public LaunchException(String message) {
    super(CliRunnerErrorCode.LAUNCH_FAILED, message);
  }

  public LaunchException(String message, Throwable cause) {
    super(CliRunnerErrorCode.LAUNCH_FAILED, message, cause);
  }
}
