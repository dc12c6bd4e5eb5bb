package com.gentoro.clirunner.connector;

import com.gentoro.clirunner.exception.ConfigException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Settings of one connector, read from {@code connectors.<name>.command}, {@code .args} and
 * {@code .available}.
 */
public record ConnectorSettings(String command, List<String> args, boolean available) {

  public ConnectorSettings {
    if (command == null || command.isBlank()) {
      throw new ConfigException("Connector command must not be blank");
    }
    args = args == null ? List.of() : List.copyOf(args);
  }

  public static ConnectorSettings from(
      Configuration config, String name, String defaultCommand, boolean defaultAvailable) {
    String prefix = "connectors." + name;
    String command = config.getString(prefix + ".command", defaultCommand);
    List<String> args = config.getList(String.class, prefix + ".args", List.of());
    boolean available = config.getBoolean(prefix + ".available", defaultAvailable);
    if (command == null || command.isBlank()) {
      throw new ConfigException("Missing %s.command configuration".formatted(prefix));
    }
    return new ConnectorSettings(command.trim(), args, available);
  }
}
