package com.gentoro.clirunner;

public class CliRunnerApp {

  private static final org.slf4j.Logger log =
      com.gentoro.clirunner.logging.LoggingService.getLogger(CliRunnerApp.class);

  public static void main(String[] args) {
    try {
      CliRunner app = new CliRunner(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
