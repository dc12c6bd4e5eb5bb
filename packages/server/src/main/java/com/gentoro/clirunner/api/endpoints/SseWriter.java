package com.gentoro.clirunner.api.endpoints;

import com.gentoro.clirunner.runner.JobEvent;
import com.gentoro.clirunner.runner.JobJson;
import com.gentoro.clirunner.utility.JacksonUtility;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes server-sent events: {@code event: <kind>\ndata: <json>\n\n}. Every write is flushed so a
 * vanished client surfaces as an {@link IOException}.
 */
final class SseWriter {
  private final OutputStream out;

  SseWriter(OutputStream out) {
    this.out = out;
  }

  void write(JobEvent event) throws IOException {
    String frame =
        "event: "
            + event.kind().wireName()
            + "\ndata: "
            + JacksonUtility.toJson(JobJson.eventNode(event))
            + "\n\n";
    send(frame);
  }

  /** Comment line; ignored by clients, used to detect disconnects on idle streams. */
  void comment(String text) throws IOException {
    send(": " + text + "\n\n");
  }

  private void send(String frame) throws IOException {
    out.write(frame.getBytes(StandardCharsets.UTF_8));
    out.flush();
  }
}
