package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.exception.CliRunnerException;
import com.gentoro.clirunner.exception.NotFoundException;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobJson;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;

/** GET /process/{id} returns the status snapshot; DELETE /process/{id} stops and removes it. */
public final class ProcessServlet extends JsonServlet {
  private static final Logger log = LoggingService.getLogger(ProcessServlet.class);

  private final JobRegistry registry;

  public ProcessServlet(JobRegistry registry) {
    this.registry = registry;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<Job> job = registry.find(pathId(req));
    if (job.isEmpty()) {
      sendError(resp, 404, "Process not found");
      return;
    }
    sendJson(resp, 200, JobJson.snapshotNode(job.get().snapshot()));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String id = pathId(req);
    try {
      registry.stop(id);
    } catch (NotFoundException e) {
      sendError(resp, 404, "Process not found");
      return;
    }
    try {
      registry.remove(id);
    } catch (CliRunnerException e) {
      log.warn("Failed to remove process {}: {}", id, e.getMessage());
      sendError(resp, 400, e.getMessage());
      return;
    }
    log.info("Process {} stopped and removed", id);
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("message", "Process deleted successfully");
    sendJson(resp, 200, node);
  }
}
