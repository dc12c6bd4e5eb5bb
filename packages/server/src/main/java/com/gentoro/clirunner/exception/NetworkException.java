package com.gentoro.clirunner.exception;

/** Failures binding or running the HTTP listener. */
public class NetworkException extends CliRunnerException {
  public NetworkException(String message) {
    super(CliRunnerErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(CliRunnerErrorCode.NETWORK_ERROR, message, cause);
  }
}
