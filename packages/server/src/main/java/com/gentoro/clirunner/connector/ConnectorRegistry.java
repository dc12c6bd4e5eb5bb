package com.gentoro.clirunner.connector;

import com.gentoro.clirunner.exception.ConflictException;
import com.gentoro.clirunner.exception.NotFoundException;
import com.gentoro.clirunner.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Connectors by name. */
public final class ConnectorRegistry {
  private static final Logger log = LoggingService.getLogger(ConnectorRegistry.class);

  private final Map<String, Connector> connectors = new TreeMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  /** Registry with the built-in connectors, configured from {@code connectors.*}. */
  public static ConnectorRegistry fromConfiguration(Configuration config) {
    ConnectorRegistry registry = new ConnectorRegistry();
    registry.register(
        new ClaudeConnector(
            ConnectorSettings.from(config, ClaudeConnector.NAME, ClaudeConnector.NAME, true)));
    registry.register(
        new GeminiConnector(
            ConnectorSettings.from(config, GeminiConnector.NAME, GeminiConnector.NAME, false)));
    return registry;
  }

  /** Add a connector, replacing any previous one with the same name. */
  public void register(Connector connector) {
    lock.writeLock().lock();
    try {
      connectors.put(connector.name(), connector);
    } finally {
      lock.writeLock().unlock();
    }
    log.info(
        "Registered connector '{}' ({})",
        connector.name(),
        connector.isAvailable() ? "available" : "unavailable");
  }

  /**
   * Look up a usable connector.
   *
   * @throws NotFoundException when no connector has that name
   * @throws ConflictException when the connector exists but is unavailable
   */
  public Connector find(String name) {
    Connector connector;
    lock.readLock().lock();
    try {
      connector = name == null ? null : connectors.get(name);
    } finally {
      lock.readLock().unlock();
    }
    if (connector == null) {
      throw new NotFoundException("connector not found: " + name);
    }
    if (!connector.isAvailable()) {
      throw new ConflictException("connector unavailable: " + name);
    }
    return connector;
  }

  /** Every registered name, sorted. */
  public List<String> names() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(connectors.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Names of available connectors, sorted. */
  public List<String> available() {
    lock.readLock().lock();
    try {
      List<String> names = new ArrayList<>();
      for (Connector c : connectors.values()) {
        if (c.isAvailable()) {
          names.add(c.name());
        }
      }
      return names;
    } finally {
      lock.readLock().unlock();
    }
  }
}
