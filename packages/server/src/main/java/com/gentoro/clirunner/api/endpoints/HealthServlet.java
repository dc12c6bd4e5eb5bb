package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Liveness and readiness probes; answers {@code {"status": <status>}}. */
public final class HealthServlet extends JsonServlet {
  private final String status;

  public HealthServlet(String status) {
    this.status = status;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("status", status);
    sendJson(resp, 200, node);
  }
}
