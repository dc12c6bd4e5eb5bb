package com.gentoro.clirunner.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends CliRunnerException {
  public ConfigException(String message) {
    super(CliRunnerErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(CliRunnerErrorCode.CONFIG_ERROR, message, cause);
  }
}
