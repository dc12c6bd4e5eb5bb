package com.gentoro.clirunner.exception;

/** Stable error codes attached to every {@link CliRunnerException}. */
public enum CliRunnerErrorCode {
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  /** The concurrency ceiling was reached; retrying later may succeed. */
  ADMISSION_REJECTED,
  NOT_FOUND,
  CONFLICT,
  /** An external process could not be started. */
  LAUNCH_FAILED
}
