package com.gentoro.clirunner.connector;

/** Runs the Claude CLI: {@code claude <args...> -p <prompt>} with stream-json output. */
public final class ClaudeConnector extends JsonLinesConnector {
  public static final String NAME = "claude";

  public ClaudeConnector(ConnectorSettings settings) {
    super(settings);
  }

  @Override
  public String name() {
    return NAME;
  }
}
