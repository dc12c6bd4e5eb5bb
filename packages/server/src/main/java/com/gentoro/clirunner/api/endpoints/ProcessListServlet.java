package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobJson;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /processes */
public final class ProcessListServlet extends JsonServlet {
  private final JobRegistry registry;

  public ProcessListServlet(JobRegistry registry) {
    this.registry = registry;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode processes = node.putArray("processes");
    for (Job job : registry.list()) {
      processes.add(JobJson.snapshotNode(job.snapshot()));
    }
    node.put("count", processes.size());
    sendJson(resp, 200, node);
  }
}
