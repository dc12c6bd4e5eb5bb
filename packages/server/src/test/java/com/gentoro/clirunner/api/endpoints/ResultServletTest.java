package com.gentoro.clirunner.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.JobResult;
import com.gentoro.clirunner.runner.JobStatus;
import com.gentoro.clirunner.runner.RunnerSettings;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultServletTest {

  private JobRegistry registry;
  private ServletTesting http;

  @BeforeEach
  void setUp() throws Exception {
    registry = new JobRegistry(RunnerSettings.defaults());
    http = new ServletTesting(new ResultServlet(registry), "/result/*");
  }

  @AfterEach
  void tearDown() throws Exception {
    http.close();
    registry.close();
  }

  @Test
  void activeJobAnswers202() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.markRunning();

    HttpTester.Response resp = http.request("GET", "/result/" + job.id());

    assertEquals(202, resp.getStatus());
    JsonNode body = ServletTesting.json(resp);
    assertEquals("running", body.get("status").asText());
    assertEquals("Process is still running", body.get("message").asText());
  }

  @Test
  void completedJobReturnsResultWithEmbeddedOutput() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.finish(
        JobStatus.COMPLETED, JobResult.success("{\"type\":\"result\",\"result\":\"answer\"}"));

    HttpTester.Response resp = http.request("GET", "/result/" + job.id());

    assertEquals(200, resp.getStatus());
    JsonNode body = ServletTesting.json(resp);
    assertEquals(0, body.get("exitCode").asInt());
    assertEquals("answer", body.get("output").get("result").asText());
    assertFalse(body.has("error"));
  }

  @Test
  void stoppedJobReturnsErrorResult() throws Exception {
    Job job = registry.create("claude", "p", null);
    job.stop();

    JsonNode body = ServletTesting.json(http.request("GET", "/result/" + job.id()));

    assertEquals(-1, body.get("exitCode").asInt());
    assertEquals("Process stopped", body.get("error").asText());
    assertFalse(body.has("output"));
  }

  @Test
  void unknownJobIs404() throws Exception {
    assertEquals(404, http.request("GET", "/result/nope").getStatus());
  }
}
