package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.connector.Connector;
import com.gentoro.clirunner.connector.ConnectorRegistry;
import com.gentoro.clirunner.exception.AdmissionException;
import com.gentoro.clirunner.exception.CliRunnerException;
import com.gentoro.clirunner.exception.ConflictException;
import com.gentoro.clirunner.exception.ExceptionUtil;
import com.gentoro.clirunner.exception.LaunchException;
import com.gentoro.clirunner.exception.NotFoundException;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.ProcessSpawner;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/** POST /run — body {@code {connector, prompt, workDir?}}; answers 202 {@code {processId}}. */
public final class RunServlet extends JsonServlet {
  private static final Logger log = LoggingService.getLogger(RunServlet.class);

  private final JobRegistry registry;
  private final ProcessSpawner spawner;
  private final ConnectorRegistry connectors;

  public RunServlet(JobRegistry registry, ProcessSpawner spawner, ConnectorRegistry connectors) {
    this.registry = registry;
    this.spawner = spawner;
    this.connectors = connectors;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body;
    try {
      body = JacksonUtility.getJsonMapper().readTree(req.getInputStream());
    } catch (JsonProcessingException e) {
      log.warn("Invalid request body: {}", e.getOriginalMessage());
      sendError(resp, 400, "Invalid request body", e.getOriginalMessage());
      return;
    }
    if (body == null || !body.isObject()) {
      sendError(resp, 400, "Invalid request body", "expected a JSON object");
      return;
    }
    String connectorName = text(body, "connector");
    String prompt = text(body, "prompt");
    String workDir = text(body, "workDir");
    if (connectorName == null) {
      sendError(resp, 400, "Invalid request body", "connector is required");
      return;
    }
    if (prompt == null) {
      sendError(resp, 400, "Invalid request body", "prompt is required");
      return;
    }

    Connector connector;
    try {
      connector = connectors.find(connectorName);
    } catch (NotFoundException | ConflictException e) {
      log.warn("Connector '{}' rejected: {}", connectorName, e.getMessage());
      sendError(
          resp, 400, "Connector '%s' not found or unavailable".formatted(connectorName));
      return;
    }

    Job job;
    try {
      job = registry.create(connector.name(), prompt, workDir);
    } catch (AdmissionException e) {
      sendError(resp, 429, "Maximum concurrent processes reached");
      return;
    } catch (CliRunnerException e) {
      log.error("Failed to create process", e);
      sendError(resp, 500, "Failed to create process", ExceptionUtil.extractErrorMessage(e));
      return;
    }

    try {
      spawner.spawn(job, connector);
    } catch (LaunchException e) {
      log.error("Failed to spawn process {}", job.id(), e);
      sendError(resp, 500, "Failed to spawn process", e.getMessage());
      return;
    }

    log.info("Process {} spawned with connector '{}'", job.id(), connector.name());
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("processId", job.id());
    sendJson(resp, 202, node);
  }

  private static String text(JsonNode body, String field) {
    JsonNode value = body.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText();
  }
}
