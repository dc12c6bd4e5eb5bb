package com.gentoro.clirunner.api;

import com.gentoro.clirunner.CliRunner;
import com.gentoro.clirunner.api.endpoints.ConnectorListServlet;
import com.gentoro.clirunner.api.endpoints.HealthServlet;
import com.gentoro.clirunner.api.endpoints.ProcessListServlet;
import com.gentoro.clirunner.api.endpoints.ProcessServlet;
import com.gentoro.clirunner.api.endpoints.ResultDataServlet;
import com.gentoro.clirunner.api.endpoints.ResultServlet;
import com.gentoro.clirunner.api.endpoints.RunServlet;
import com.gentoro.clirunner.api.endpoints.StreamServlet;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.utility.DurationUtility;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.slf4j.Logger;

/**
 * Registers the job API servlets under {@code http.api.context-path} (default {@code /api/v1}),
 * plus the {@code /health} and {@code /ready} probes at the root.
 */
public final class ApiServer {
  private static final Logger log = LoggingService.getLogger(ApiServer.class);

  public static final String DEFAULT_CONTEXT_PATH = "/api/v1";
  public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(15);

  private final CliRunner cliRunner;

  public ApiServer(CliRunner cliRunner) {
    this.cliRunner = cliRunner;
  }

  String contextPath() {
    String path =
        cliRunner.configuration().getString("http.api.context-path", DEFAULT_CONTEXT_PATH);
    if (path == null || path.isBlank() || "/".equals(path.trim())) {
      return "";
    }
    path = path.trim();
    if (!path.startsWith("/")) {
      path = "/" + path;
    }
    return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
  }

  Duration heartbeat() {
    return DurationUtility.getPositive(
        cliRunner.configuration(), "http.stream.heartbeat", DEFAULT_HEARTBEAT);
  }

  /** Register all servlets with the Jetty context handler. */
  public void register() {
    ServletContextHandler ctx = cliRunner.httpServer().getContextHandler();
    String base = contextPath();

    ctx.addServlet(
        new ServletHolder(
            new RunServlet(cliRunner.registry(), cliRunner.spawner(), cliRunner.connectors())),
        "%s/run".formatted(base));
    ctx.addServlet(
        new ServletHolder(new StreamServlet(cliRunner.registry(), heartbeat())),
        "%s/stream/*".formatted(base));
    ctx.addServlet(
        new ServletHolder(new ProcessServlet(cliRunner.registry())),
        "%s/process/*".formatted(base));
    ctx.addServlet(
        new ServletHolder(new ResultServlet(cliRunner.registry())),
        "%s/result/*".formatted(base));
    ctx.addServlet(
        new ServletHolder(new ResultDataServlet(cliRunner.registry())),
        "%s/result-data/*".formatted(base));
    ctx.addServlet(
        new ServletHolder(new ProcessListServlet(cliRunner.registry())),
        "%s/processes".formatted(base));
    ctx.addServlet(
        new ServletHolder(new ConnectorListServlet(cliRunner.connectors())),
        "%s/connectors".formatted(base));

    // Streams log their own lifecycle.
    cliRunner.httpServer().ignoreRequestLogPaths("%s/stream/*".formatted(base));

    ctx.addServlet(new ServletHolder(new HealthServlet("healthy")), "/health");
    ctx.addServlet(new ServletHolder(new HealthServlet("ready")), "/ready");

    log.info("Job API registered under '{}'", base.isEmpty() ? "/" : base);
  }
}
