package com.gentoro.clirunner.connector;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clirunner.runner.EventKind;
import com.gentoro.clirunner.runner.JobEvent;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClaudeConnectorTest {

  private final ClaudeConnector connector =
      new ClaudeConnector(
          new ConnectorSettings(
              "claude", List.of("--output-format", "stream-json", "--verbose"), true));

  @Test
  @DisplayName("the prompt is passed with -p after the configured arguments")
  void buildsCommand() {
    CommandLine command = connector.buildCommand("explain this repo");

    assertEquals("claude", command.executable());
    assertEquals(
        List.of("claude", "--output-format", "stream-json", "--verbose", "-p", "explain this repo"),
        command.toList());
  }

  @Test
  void resultObjectsBecomeResultEvents() {
    Optional<JobEvent> event = connector.parseLine("{\"type\":\"result\",\"result\":\"ok\"}");

    assertTrue(event.isPresent());
    assertEquals(EventKind.RESULT, event.get().kind());
    assertEquals("{\"type\":\"result\",\"result\":\"ok\"}", event.get().payload());
  }

  @Test
  void otherObjectsBecomeOutputEvents() {
    assertEquals(
        EventKind.OUTPUT, connector.parseLine("{\"type\":\"assistant\"}").orElseThrow().kind());
    assertEquals(EventKind.OUTPUT, connector.parseLine("{\"message\":1}").orElseThrow().kind());
    assertEquals(EventKind.OUTPUT, connector.parseLine("{\"type\":5}").orElseThrow().kind());
  }

  @Test
  @DisplayName("surrounding whitespace is trimmed from the payload")
  void trimsWhitespace() {
    JobEvent event = connector.parseLine("  {\"type\":\"result\"}\r").orElseThrow();
    assertEquals("{\"type\":\"result\"}", event.payload());
  }

  @Test
  @DisplayName("blank, non-JSON and non-object lines are dropped")
  void dropsUnrecognizedLines() {
    assertTrue(connector.parseLine(null).isEmpty());
    assertTrue(connector.parseLine("").isEmpty());
    assertTrue(connector.parseLine("   ").isEmpty());
    assertTrue(connector.parseLine("Loading...").isEmpty());
    assertTrue(connector.parseLine("{\"type\":").isEmpty());
    assertTrue(connector.parseLine("[1,2,3]").isEmpty());
    assertTrue(connector.parseLine("\"text\"").isEmpty());
    assertTrue(connector.parseLine("{} trailing").isEmpty());
  }

  @Test
  void availabilityComesFromSettings() {
    assertTrue(connector.isAvailable());
    assertEquals("claude", connector.name());
    ClaudeConnector disabled = new ClaudeConnector(new ConnectorSettings("claude", null, false));
    assertFalse(disabled.isAvailable());
    assertEquals(List.of("claude", "-p", "x"), disabled.buildCommand("x").toList());
  }
}
