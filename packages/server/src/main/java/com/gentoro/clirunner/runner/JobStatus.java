package com.gentoro.clirunner.runner;

import java.util.Locale;

/** Lifecycle state of a job. Terminal states are absorbing. */
public enum JobStatus {
  /** Job accepted but the external process has not been launched yet. */
  PENDING,
  /** The external process is being launched or is executing. */
  RUNNING,
  /** The process exited with code 0. */
  COMPLETED,
  /** The process exited nonzero, could not be launched, or its output could not be read. */
  FAILED,
  /** Cancelled by an explicit stop request or by the job timeout. */
  STOPPED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == STOPPED;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
