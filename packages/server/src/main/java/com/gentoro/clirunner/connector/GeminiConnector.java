package com.gentoro.clirunner.connector;

/** Runs the Gemini CLI: {@code gemini <args...> -p <prompt>}. Disabled unless configured. */
public final class GeminiConnector extends JsonLinesConnector {
  public static final String NAME = "gemini";

  public GeminiConnector(ConnectorSettings settings) {
    super(settings);
  }

  @Override
  public String name() {
    return NAME;
  }
}
