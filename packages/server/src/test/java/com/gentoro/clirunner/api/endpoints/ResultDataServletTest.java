package com.gentoro.clirunner.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clirunner.runner.EventKind;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobEvent;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.JobResult;
import com.gentoro.clirunner.runner.JobStatus;
import com.gentoro.clirunner.runner.MutableClock;
import com.gentoro.clirunner.runner.RunnerSettings;
import java.time.Duration;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultDataServletTest {

  private final MutableClock clock = new MutableClock();
  private JobRegistry registry;
  private ServletTesting http;

  @BeforeEach
  void setUp() throws Exception {
    registry = new JobRegistry(RunnerSettings.defaults(), clock);
    http = new ServletTesting(new ResultDataServlet(registry), "/result-data/*");
  }

  @AfterEach
  void tearDown() throws Exception {
    http.close();
    registry.close();
  }

  @Test
  @DisplayName("the cached result payload is returned as JSON")
  void returnsCachedPayload() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(
        JobEvent.of(EventKind.RESULT, "{\"type\":\"result\",\"result\":\"42\",\"cost\":0.1}"));

    HttpTester.Response resp = http.request("GET", "/result-data/" + job.id());

    assertEquals(200, resp.getStatus());
    JsonNode body = ServletTesting.json(resp);
    assertEquals("result", body.get("type").asText());
    assertEquals("42", body.get("result").asText());
  }

  @Test
  void noResultEventIs404() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(JobEvent.of(EventKind.OUTPUT, "{\"type\":\"assistant\"}"));

    HttpTester.Response resp = http.request("GET", "/result-data/" + job.id());

    assertEquals(404, resp.getStatus());
    assertEquals(
        "Result data not found or expired", ServletTesting.json(resp).get("error").asText());
  }

  @Test
  void expiredResultIs404() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(JobEvent.of(EventKind.RESULT, "{\"type\":\"result\"}"));
    clock.advance(Duration.ofMinutes(10));

    assertEquals(404, http.request("GET", "/result-data/" + job.id()).getStatus());
  }

  @Test
  @DisplayName("the payload is still served after the job has been removed")
  void servedAfterRemoval() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.appendEvent(JobEvent.of(EventKind.RESULT, "{\"type\":\"result\",\"result\":\"kept\"}"));
    job.finish(JobStatus.COMPLETED, JobResult.success(null));
    registry.remove(job.id());

    HttpTester.Response resp = http.request("GET", "/result-data/" + job.id());

    assertEquals(200, resp.getStatus());
    assertEquals("kept", ServletTesting.json(resp).get("result").asText());
  }

  @Test
  void unknownJobIs404() throws Exception {
    assertEquals(404, http.request("GET", "/result-data/nope").getStatus());
  }
}
