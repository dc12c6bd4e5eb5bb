package com.gentoro.clirunner.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be tuned from the application configuration using
 * {@code logging.level.root} and {@code logging.level.<logger-name>} keys.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels declared in the configuration. Does nothing when the SLF4J binding is not
   * Logback.
   */
  public static void applyConfiguration(Configuration configuration) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }
    Logger log = getLogger(LoggingService.class);
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String value = configuration.getString(key);
      if (key.length() <= LEVEL_PREFIX.length() + 1 || value == null || value.isBlank()) {
        continue;
      }
      // Dots inside YAML map keys come back doubled.
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      Level level = Level.toLevel(value.trim(), Level.INFO);
      context.getLogger(loggerName).setLevel(level);
      log.debug("Logger '{}' set to {}", loggerName, level);
    }
  }
}
