package com.gentoro.clirunner;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clirunner.exception.StateException;
import com.gentoro.clirunner.utility.JacksonUtility;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CliRunnerTest {

  private static final String TOOL_SCRIPT =
      """
      echo '{"type":"system","subtype":"init"}'
      echo "{\\"type\\":\\"assistant\\",\\"text\\":\\"$2\\"}"
      echo 'progress: not json'
      echo '{"type":"result","result":"all done"}'
      """;

  private final HttpClient client =
      HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
  private CliRunner runner;

  @AfterEach
  void tearDown() {
    if (runner != null) {
      runner.shutdown();
    }
  }

  private CliRunner start(Path dir) throws Exception {
    Path tool = dir.resolve("tool.sh");
    Files.writeString(tool, TOOL_SCRIPT);
    Path config = dir.resolve("application.yaml");
    Files.writeString(
        config,
        """
        http:
          hostname: 127.0.0.1
          port: 0
          api:
            context-path: /api/v1
          stream:
            heartbeat: 100ms
        process:
          maxConcurrent: 2
        connectors:
          claude:
            command: /bin/sh
            args: ["%s"]
            available: true
        logging:
          level:
            root: WARN
        """
            .formatted(tool));
    runner = new CliRunner(new String[] {"--config-file=" + config});
    runner.initialize();
    return runner;
  }

  private String base() {
    return "http://127.0.0.1:" + runner.httpServer().getPort();
  }

  private HttpResponse<String> get(String path) throws Exception {
    HttpRequest req =
        HttpRequest.newBuilder(URI.create(base() + path)).timeout(Duration.ofSeconds(10)).build();
    return client.send(req, HttpResponse.BodyHandlers.ofString());
  }

  @Test
  @DisplayName("run, stream, inspect and delete a job over HTTP")
  void fullJobLifecycle(@TempDir Path dir) throws Exception {
    start(dir);

    HttpRequest run =
        HttpRequest.newBuilder(URI.create(base() + "/api/v1/run"))
            .header("Content-Type", "application/json")
            .timeout(Duration.ofSeconds(10))
            .POST(
                HttpRequest.BodyPublishers.ofString(
                    "{\"connector\":\"claude\",\"prompt\":\"hello world\"}"))
            .build();
    HttpResponse<String> accepted = client.send(run, HttpResponse.BodyHandlers.ofString());
    assertEquals(202, accepted.statusCode());
    String id = JacksonUtility.tryParse(accepted.body()).get("processId").asText();

    HttpResponse<String> stream = get("/api/v1/stream/" + id);
    assertEquals(200, stream.statusCode());
    assertTrue(stream.body().contains("event: output"));
    assertTrue(stream.body().contains("hello world"));
    assertTrue(stream.body().contains("event: result"));
    assertTrue(stream.body().contains("event: done"));
    assertFalse(stream.body().contains("progress: not json"));

    long end = System.currentTimeMillis() + 5000;
    HttpResponse<String> result = get("/api/v1/result/" + id);
    while (result.statusCode() == 202 && System.currentTimeMillis() < end) {
      Thread.sleep(20);
      result = get("/api/v1/result/" + id);
    }
    assertEquals(200, result.statusCode());
    JsonNode resultBody = JacksonUtility.tryParse(result.body());
    assertEquals(0, resultBody.get("exitCode").asInt());
    assertEquals("all done", resultBody.get("output").get("result").asText());

    HttpResponse<String> data = get("/api/v1/result-data/" + id);
    assertEquals(200, data.statusCode());
    assertEquals("all done", JacksonUtility.tryParse(data.body()).get("result").asText());

    JsonNode status = JacksonUtility.tryParse(get("/api/v1/process/" + id).body());
    assertEquals("completed", status.get("status").asText());

    JsonNode list = JacksonUtility.tryParse(get("/api/v1/processes").body());
    assertEquals(1, list.get("count").asInt());

    JsonNode connectors = JacksonUtility.tryParse(get("/api/v1/connectors").body());
    assertEquals("claude", connectors.get("connectors").get(0).asText());

    HttpRequest delete =
        HttpRequest.newBuilder(URI.create(base() + "/api/v1/process/" + id))
            .timeout(Duration.ofSeconds(10))
            .DELETE()
            .build();
    assertEquals(200, client.send(delete, HttpResponse.BodyHandlers.ofString()).statusCode());
    assertEquals(404, get("/api/v1/process/" + id).statusCode());
    assertEquals(200, get("/api/v1/result-data/" + id).statusCode());
  }

  @Test
  void probes(@TempDir Path dir) throws Exception {
    start(dir);

    assertEquals(
        "healthy", JacksonUtility.tryParse(get("/health").body()).get("status").asText());
    assertEquals("ready", JacksonUtility.tryParse(get("/ready").body()).get("status").asText());
    assertEquals(404, get("/api/v1/stream/unknown").statusCode());
  }

  @Test
  void configurationIsUnavailableBeforeInitialize() {
    CliRunner notStarted = new CliRunner(new String[0]);
    assertThrows(StateException.class, notStarted::configuration);
  }
}
