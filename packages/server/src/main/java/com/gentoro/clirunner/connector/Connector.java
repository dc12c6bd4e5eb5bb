package com.gentoro.clirunner.connector;

import com.gentoro.clirunner.runner.JobEvent;
import java.util.Optional;

/**
 * Strategy for invoking one external command-line tool and interpreting its output. The job engine
 * only depends on this interface.
 */
public interface Connector {

  /** Unique name used by clients to select this connector. */
  String name();

  boolean isAvailable();

  /** Command line that runs the tool for {@code prompt}. */
  CommandLine buildCommand(String prompt);

  /**
   * Translate one line of tool output into an event. Blank or unrecognized lines yield {@link
   * Optional#empty()}. Implementations should not throw.
   */
  Optional<JobEvent> parseLine(String line);
}
