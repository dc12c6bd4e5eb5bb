package com.gentoro.clirunner.http;

import com.gentoro.clirunner.exception.ConfigException;
import com.gentoro.clirunner.exception.ExceptionUtil;
import com.gentoro.clirunner.exception.NetworkException;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.utility.DurationUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.CustomRequestLog;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.Slf4jRequestLogWriter;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the {@link
 * ServletContextHandler} so that the API can register its servlets before the server starts.
 * Every request is written to the {@value #REQUEST_LOG_NAME} logger (client, method, path, status,
 * elapsed time) except for paths excluded with {@link #ignoreRequestLogPaths(String...)}.
 *
 * <p>{@code http.readTimeout} and {@code http.writeTimeout} (default 30s each) bound how long a
 * connection may stay idle; Jetty has a single idle timeout, so the larger of the two applies.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 4001;
  public static final Duration DEFAULT_IO_TIMEOUT = Duration.ofSeconds(30);
  public static final String REQUEST_LOG_NAME = "com.gentoro.clirunner.http.RequestLog";
  static final String REQUEST_LOG_FORMAT = "%{client}a \"%m %U\" %s %{ms}Tms";
  private static final long STOP_TIMEOUT_MILLIS = 2000;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;
  private CustomRequestLog requestLog;
  private final List<String> ignoredLogPaths = new ArrayList<>();

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty server and root context without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", DEFAULT_PORT);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      Duration idleTimeout;
      try {
        Duration read =
            DurationUtility.getPositive(configuration, "http.readTimeout", DEFAULT_IO_TIMEOUT);
        Duration write =
            DurationUtility.getPositive(configuration, "http.writeTimeout", DEFAULT_IO_TIMEOUT);
        idleTimeout = read.compareTo(write) >= 0 ? read : write;
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http timeouts", ex));
      }

      try {
        // Daemon threads so that a failed start never keeps the JVM alive.
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        connector.setIdleTimeout(idleTimeout.toMillis());
        server.addConnector(connector);

        Slf4jRequestLogWriter writer = new Slf4jRequestLogWriter();
        writer.setLoggerName(REQUEST_LOG_NAME);
        requestLog = new CustomRequestLog(writer, REQUEST_LOG_FORMAT);
        requestLog.setIgnorePaths(ignoredLogPaths.toArray(new String[0]));
        server.setRequestLog(requestLog);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
        log.trace("Jetty prepared for {}:{} (idle timeout {})", hostname, port, idleTimeout);
      } catch (Exception e) {
        throw new NetworkException("Could not initialize the HTTP server", e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Could not start the HTTP server; check that the configured port and "
                        + "hostname are available",
                    ex));
      }
    }
  }

  /** Stop Jetty. Failures are logged, not rethrown, so that other services can still stop. */
  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isStarted() || s.isStarting()) {
          s.setStopTimeout(STOP_TIMEOUT_MILLIS);
          s.stop();
          log.info("Jetty stopped");
        }
      } catch (Exception e) {
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
        requestLog = null;
      }
    }
  }

  /**
   * Exclude requests matching the given servlet path specs (for example {@code /api/v1/stream/*})
   * from the request log. Takes effect when the server starts.
   */
  public void ignoreRequestLogPaths(String... pathSpecs) {
    synchronized (lifecycleLock) {
      ignoredLogPaths.addAll(List.of(pathSpecs));
      if (requestLog != null) {
        requestLog.setIgnorePaths(ignoredLogPaths.toArray(new String[0]));
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** The bound port once started, otherwise the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (var connector : server.getConnectors()) {
          if (connector instanceof ServerConnector serverConnector) {
            return serverConnector.getLocalPort();
          }
        }
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
