package com.gentoro.clirunner.api.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import org.slf4j.Logger;

/** Base for endpoints answering with JSON bodies. Error bodies are {@code {error, details?}}. */
abstract class JsonServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(JsonServlet.class);

  /** The single path segment after the servlet mapping, or {@code null} if there is none. */
  static String pathId(HttpServletRequest req) {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) {
      return null;
    }
    String id = path.substring(1);
    return id.isBlank() || id.contains("/") ? null : id;
  }

  static void sendJson(HttpServletResponse resp, int code, Object body) throws IOException {
    String json = JacksonUtility.toJson(body);
    log.trace("Sending response ({}): {}", code, json);
    resp.setStatus(code);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(json);
    }
  }

  static void sendError(HttpServletResponse resp, int code, String error) throws IOException {
    sendError(resp, code, error, null);
  }

  static void sendError(HttpServletResponse resp, int code, String error, String details)
      throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", error);
    if (details != null) {
      node.put("details", details);
    }
    sendJson(resp, code, node);
  }
}
