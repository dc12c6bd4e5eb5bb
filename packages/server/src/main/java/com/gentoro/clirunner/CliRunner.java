package com.gentoro.clirunner;

import com.gentoro.clirunner.api.ApiServer;
import com.gentoro.clirunner.connector.ConnectorRegistry;
import com.gentoro.clirunner.exception.ExceptionUtil;
import com.gentoro.clirunner.exception.NetworkException;
import com.gentoro.clirunner.exception.StateException;
import com.gentoro.clirunner.http.EmbeddedJettyServer;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.ProcessSpawner;
import com.gentoro.clirunner.runner.RunnerSettings;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, wires the job registry, spawner, connectors and HTTP
 * server, and owns start-up and shutdown.
 */
public class CliRunner {

  private static final org.slf4j.Logger log = LoggingService.getLogger(CliRunner.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private RunnerSettings settings;
  private JobRegistry registry;
  private ProcessSpawner spawner;
  private ConnectorRegistry connectors;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public CliRunner(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from the configuration as early as possible
    LoggingService.applyConfiguration(configuration());

    this.settings = RunnerSettings.from(configuration());
    this.connectors = ConnectorRegistry.fromConfiguration(configuration());
    this.registry = new JobRegistry(settings);
    this.spawner = new ProcessSpawner(settings);

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ApiServer(this).register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new NetworkException("Could not start http server", ex));
    }

    registry.startCleanup();
    log.info(
        "CLI runner ready: connectors {}, max {} concurrent jobs",
        connectors.available(),
        settings.maxConcurrent());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "cli-runner-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void closeQuietly(String name, AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error closing {}: {}", name, e.getMessage());
      }
    }
  }

  private void triggerShutdown(String reason) {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down ({})", reason);
      try {
        // Stop accepting requests, then stop jobs, then wait for their supervisors.
        closeQuietly("http server", httpServer);
        closeQuietly("job registry", registry);
        closeQuietly("process spawner", spawner);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("CliRunner not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public RunnerSettings settings() {
    return settings;
  }

  public JobRegistry registry() {
    return registry;
  }

  public ProcessSpawner spawner() {
    return spawner;
  }

  public ConnectorRegistry connectors() {
    return connectors;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
