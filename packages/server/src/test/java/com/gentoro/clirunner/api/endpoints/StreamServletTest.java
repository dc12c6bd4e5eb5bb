package com.gentoro.clirunner.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clirunner.runner.EventKind;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobEvent;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.JobResult;
import com.gentoro.clirunner.runner.JobStatus;
import com.gentoro.clirunner.runner.RunnerSettings;
import com.gentoro.clirunner.utility.JacksonUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StreamServletTest {

  private JobRegistry registry;
  private ServletTesting http;

  @BeforeEach
  void setUp() throws Exception {
    registry = new JobRegistry(RunnerSettings.defaults());
    http = new ServletTesting(new StreamServlet(registry, Duration.ofMillis(50)), "/stream/*");
  }

  @AfterEach
  void tearDown() throws Exception {
    http.close();
    registry.close();
  }

  /** Event names of all frames, in order, skipping comment frames. */
  private static List<String> eventNames(String body) {
    List<String> names = new ArrayList<>();
    for (String frame : body.split("\n\n")) {
      if (frame.startsWith("event: ")) {
        names.add(frame.substring("event: ".length(), frame.indexOf('\n')));
      }
    }
    return names;
  }

  private static JsonNode dataOf(String body, String eventName) {
    for (String frame : body.split("\n\n")) {
      if (frame.startsWith("event: " + eventName + "\n")) {
        return JacksonUtility.tryParse(frame.substring(frame.indexOf("data: ") + 6));
      }
    }
    return null;
  }

  @Test
  @DisplayName("a finished job replays its history and ends with done")
  void replaysFinishedJob() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(JobEvent.of(EventKind.OUTPUT, "{\"type\":\"assistant\",\"n\":1}"));
    job.appendEvent(JobEvent.of(EventKind.RESULT, "{\"type\":\"result\",\"result\":\"ok\"}"));
    job.finish(JobStatus.COMPLETED, JobResult.success("{\"type\":\"result\",\"result\":\"ok\"}"));
    job.close();

    HttpTester.Response resp = http.request("GET", "/stream/" + job.id());

    assertEquals(200, resp.getStatus());
    assertTrue(resp.get("Content-Type").startsWith("text/event-stream"));
    assertEquals("no-cache", resp.get("Cache-Control"));
    String body = resp.getContent();
    assertEquals(List.of("output", "result", "done"), eventNames(body));

    JsonNode output = dataOf(body, "output");
    assertEquals("output", output.get("kind").asText());
    assertEquals(1, output.get("payload").get("n").asInt());
    assertTrue(output.has("timestamp"));

    JsonNode done = dataOf(body, "done");
    assertEquals(job.id(), done.get("payload").get("processId").asText());
    assertEquals("completed", done.get("payload").get("status").asText());
  }

  @Test
  @DisplayName("a live job streams new events, heartbeats while idle, and ends after done")
  void streamsLiveEvents() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.markRunning();
    job.appendEvent(JobEvent.of(EventKind.OUTPUT, "{\"type\":\"assistant\",\"n\":1}"));

    Thread producer =
        new Thread(
            () -> {
              try {
                Thread.sleep(400);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              job.appendEvent(JobEvent.of(EventKind.OUTPUT, "{\"type\":\"assistant\",\"n\":2}"));
              job.finish(JobStatus.FAILED, JobResult.failure(3, "process exited with code 3"));
              job.appendEvent(JobEvent.of(EventKind.ERROR, "{\"error\":\"boom\"}"));
              job.close();
            });
    producer.start();

    HttpTester.Response resp = http.request("GET", "/stream/" + job.id());
    producer.join(5000);

    String body = resp.getContent();
    List<String> names = eventNames(body);
    assertEquals("output", names.get(0));
    assertEquals("done", names.get(names.size() - 1));
    assertTrue(names.contains("error"));
    assertTrue(body.contains(": keep-alive\n\n"));
    assertEquals("failed", dataOf(body, "done").get("payload").get("status").asText());
  }

  @Test
  @DisplayName("non-JSON payloads are sent as strings")
  void plainTextPayload() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(JobEvent.of(EventKind.OUTPUT, "plain text"));
    job.stop();
    job.close();

    String body = http.request("GET", "/stream/" + job.id()).getContent();

    assertEquals("plain text", dataOf(body, "output").get("payload").asText());
  }

  @Test
  void unknownJobIs404() throws Exception {
    HttpTester.Response resp = http.request("GET", "/stream/nope");
    assertEquals(404, resp.getStatus());
    assertEquals("Process not found", ServletTesting.json(resp).get("error").asText());
  }
}
