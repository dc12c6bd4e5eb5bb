package com.gentoro.clirunner;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clirunner.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("the bundled application.yaml carries the documented defaults")
  void bundledDefaults() {
    Configuration config = new ConfigurationProvider(null, Map.of()).config();

    assertEquals(4001, config.getInt("http.port"));
    assertEquals("/api/v1", config.getString("http.api.context-path"));
    assertEquals("30m", config.getString("process.defaultTimeout"));
    assertEquals(10, config.getInt("process.maxConcurrent"));
    assertEquals("claude", config.getString("connectors.claude.command"));
    assertEquals(
        List.of("--output-format", "stream-json", "--verbose"),
        config.getList(String.class, "connectors.claude.args"));
    assertFalse(config.getBoolean("connectors.gemini.available"));
  }

  @Test
  void readsExternalFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("runner.yaml");
    Files.writeString(file, "http:\n  port: 9999\nprocess:\n  maxConcurrent: 2\n");

    Configuration config = new ConfigurationProvider(file, Map.of()).config();

    assertEquals(9999, config.getInt("http.port"));
    assertEquals(2, config.getInt("process.maxConcurrent"));
    assertFalse(config.containsKey("connectors.claude.command"));
  }

  @Test
  @DisplayName("environment variables override file values and fill in known keys")
  void environmentOverrides(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("runner.yaml");
    Files.writeString(file, "http:\n  port: 9999\n");

    Configuration config =
        new ConfigurationProvider(
                file,
                Map.of(
                    "CLI_RUNNER_HTTP_PORT", "7000",
                    "CLI_RUNNER_HTTP_API_CONTEXT_PATH", "/v2",
                    "CLI_RUNNER_PROCESS_MAXCONCURRENT", "4"))
            .config();

    assertEquals(7000, config.getInt("http.port"));
    assertEquals("/v2", config.getString("http.api.context-path"));
    assertEquals(4, config.getInt("process.maxConcurrent"));
  }

  @Test
  void envNameMapping() {
    assertEquals("CLI_RUNNER_HTTP_PORT", ConfigurationProvider.envName("http.port"));
    assertEquals(
        "CLI_RUNNER_PROCESS_CLEANUPDELAY", ConfigurationProvider.envName("process.cleanupDelay"));
    assertEquals(
        "CLI_RUNNER_HTTP_STREAM_HEARTBEAT", ConfigurationProvider.envName("http.stream.heartbeat"));
  }

  @Test
  void missingFileIsAConfigurationError(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml"), Map.of()));
  }

  @Test
  void malformedFileIsAConfigurationError(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "http: [unclosed\n");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(file, Map.of()));
  }
}
