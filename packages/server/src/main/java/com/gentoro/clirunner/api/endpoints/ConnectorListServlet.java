package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.connector.ConnectorRegistry;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/** GET /connectors — names of the connectors that can currently be used. */
public final class ConnectorListServlet extends JsonServlet {
  private final ConnectorRegistry connectors;

  public ConnectorListServlet(ConnectorRegistry connectors) {
    this.connectors = connectors;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> available = connectors.available();
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode names = node.putArray("connectors");
    available.forEach(names::add);
    node.put("count", available.size());
    sendJson(resp, 200, node);
  }
}
