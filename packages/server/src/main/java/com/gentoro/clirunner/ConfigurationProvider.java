package com.gentoro.clirunner;

import com.gentoro.clirunner.exception.ConfigException;
import com.gentoro.clirunner.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration, either from a file or from the bundled {@code application.yaml},
 * and applies environment overrides: {@code CLI_RUNNER_<KEY>} with the key upper-cased and
 * {@code .} / {@code -} replaced by {@code _} (for example {@code CLI_RUNNER_HTTP_PORT}).
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String ENV_PREFIX = "CLI_RUNNER_";
  static final String DEFAULT_RESOURCE = "application.yaml";

  /** Scalar keys that can be overridden from the environment even when absent from the file. */
  static final List<String> OVERRIDABLE_KEYS =
      List.of(
          "http.hostname",
          "http.port",
          "http.api.context-path",
          "http.stream.heartbeat",
          "process.defaultTimeout",
          "process.maxConcurrent",
          "process.cleanupDelay",
          "process.cleanupInterval",
          "process.bufferSize",
          "process.subscriberCapacity",
          "process.resultCacheTtl",
          "connectors.claude.command",
          "connectors.claude.available",
          "connectors.gemini.command",
          "connectors.gemini.available",
          "logging.level.root");

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this(configFile, System.getenv());
  }

  ConfigurationProvider(Path configFile, Map<String, String> environment) {
    this.config = load(configFile);
    applyOverrides(environment);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration load(Path configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigException("Configuration file not found: " + configFile);
      }
      try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      } catch (IOException | ConfigurationException e) {
        throw new ConfigException("Failed to read configuration file " + configFile, e);
      }
      log.info("Loaded configuration from {}", configFile.toAbsolutePath());
      return yaml;
    }
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      log.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
      return yaml;
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read bundled " + DEFAULT_RESOURCE, e);
    }
    log.debug("Loaded bundled {}", DEFAULT_RESOURCE);
    return yaml;
  }

  private void applyOverrides(Map<String, String> environment) {
    Set<String> keys = new LinkedHashSet<>(OVERRIDABLE_KEYS);
    config.getKeys().forEachRemaining(keys::add);
    for (String key : keys) {
      String value = environment.get(envName(key));
      if (value != null) {
        config.setProperty(key, value);
        log.debug("Configuration key '{}' overridden from environment", key);
      }
    }
  }

  static String envName(String key) {
    return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }
}
