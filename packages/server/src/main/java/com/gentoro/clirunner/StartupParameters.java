package com.gentoro.clirunner;

import com.gentoro.clirunner.exception.ConfigException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line options of the form {@code --name=value} or {@code --name value}. The only option
 * the service reads is {@code --config-file}.
 */
public final class StartupParameters {
  public static final String CONFIG_FILE = "config-file";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String option = arg.substring(2);
      int eq = option.indexOf('=');
      if (eq >= 0) {
        parameters.put(option.substring(0, eq), option.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(option, args[++i]);
      } else {
        parameters.put(option, "true");
      }
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Map<String, String> parameters() {
    return Collections.unmodifiableMap(parameters);
  }

  /** Path given with {@code --config-file}, or {@code null} to use the bundled configuration. */
  public Path configFile() {
    String value = parameters.get(CONFIG_FILE);
    if (value == null || value.isBlank()) {
      return null;
    }
    return Path.of(value.trim());
  }
}
