package com.gentoro.clirunner.exception;

/** Raised when the number of active jobs has reached the configured ceiling. */
public class AdmissionException extends CliRunnerException {
  public AdmissionException(String message) {
    super(CliRunnerErrorCode.ADMISSION_REJECTED, message);
  }

  public AdmissionException(String message, Throwable cause) {
    super(CliRunnerErrorCode.ADMISSION_REJECTED, message, cause);
  }
}
