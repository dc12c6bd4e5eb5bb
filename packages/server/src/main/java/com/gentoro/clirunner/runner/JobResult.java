package com.gentoro.clirunner.runner;

/**
 * Final outcome of a job, set when the job enters a terminal state.
 *
 * @param exitCode process exit code; {@code -1} when the process was stopped or timed out
 * @param output payload of the last {@code result} event, or {@code null}
 * @param errorMessage human-readable failure cause, or {@code null} on success
 */
public record JobResult(int exitCode, String output, String errorMessage) {

  public static JobResult success(String output) {
    return new JobResult(0, output, null);
  }

  public static JobResult failure(int exitCode, String errorMessage) {
    return new JobResult(exitCode, null, errorMessage);
  }

  public boolean isSuccess() {
    return exitCode == 0 && errorMessage == null;
  }
}
