package com.gentoro.clirunner.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clirunner.runner.EventKind;
import com.gentoro.clirunner.runner.JobEvent;
import com.gentoro.clirunner.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for tools that take the prompt as {@code -p <prompt>} and print one JSON object per line.
 * An object whose {@code type} is {@code "result"} becomes a {@link EventKind#RESULT} event, any
 * other object an {@link EventKind#OUTPUT} event. Lines that are not JSON objects are dropped.
 */
public abstract class JsonLinesConnector implements Connector {
  private final ConnectorSettings settings;

  protected JsonLinesConnector(ConnectorSettings settings) {
    this.settings = settings;
  }

  protected ConnectorSettings settings() {
    return settings;
  }

  @Override
  public boolean isAvailable() {
    return settings.available();
  }

  @Override
  public CommandLine buildCommand(String prompt) {
    List<String> args = new ArrayList<>(settings.args());
    args.add("-p");
    args.add(prompt);
    return new CommandLine(settings.command(), args);
  }

  @Override
  public Optional<JobEvent> parseLine(String line) {
    if (line == null) {
      return Optional.empty();
    }
    String trimmed = line.trim();
    JsonNode node = JacksonUtility.tryParse(trimmed);
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    return Optional.of(JobEvent.of(kindOf(node), trimmed));
  }

  protected EventKind kindOf(JsonNode node) {
    return "result".equals(node.path("type").asText(null)) ? EventKind.RESULT : EventKind.OUTPUT;
  }
}
