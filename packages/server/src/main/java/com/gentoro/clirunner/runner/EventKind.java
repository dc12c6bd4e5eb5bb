package com.gentoro.clirunner.runner;

import java.util.Locale;

/** Kind of a {@link JobEvent}; {@link #wireName()} is the name used on the event stream. */
public enum EventKind {
  /** Incremental tool output. */
  OUTPUT,
  /** Final answer of the tool; its payload is also kept in the job's result cache. */
  RESULT,
  ERROR,
  /** Always the last event of a job. */
  DONE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
