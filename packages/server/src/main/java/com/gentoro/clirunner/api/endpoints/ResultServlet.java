package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobJson;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.JobResult;
import com.gentoro.clirunner.runner.JobSnapshot;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/** GET /result/{id} — the final result once the job is terminal, 202 while it is still active. */
public final class ResultServlet extends JsonServlet {
  private final JobRegistry registry;

  public ResultServlet(JobRegistry registry) {
    this.registry = registry;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<Job> job = registry.find(pathId(req));
    if (job.isEmpty()) {
      sendError(resp, 404, "Process not found");
      return;
    }
    JobSnapshot snapshot = job.get().snapshot();
    JobResult result = snapshot.result();
    if (result == null) {
      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      node.put("status", snapshot.status().wireName());
      node.put("message", "Process is still running");
      sendJson(resp, 202, node);
      return;
    }
    sendJson(resp, 200, JobJson.resultNode(result));
  }
}
