package com.gentoro.clirunner.runner;

import java.time.Instant;
import java.util.Objects;

/**
 * One timestamped unit of output or status produced during a job's execution.
 *
 * @param kind the event kind
 * @param payload tool-specific content, usually a single JSON document; never interpreted by the
 *     runner except for {@link EventKind#RESULT} events, which are cached
 * @param timestamp when the event was produced; {@link Job#appendEvent(JobEvent)} restamps it with
 *     the job's clock
 */
public record JobEvent(EventKind kind, String payload, Instant timestamp) {

  public JobEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(timestamp, "timestamp");
    payload = payload == null ? "" : payload;
  }

  public static JobEvent of(EventKind kind, String payload) {
    return new JobEvent(kind, payload, Instant.now());
  }

  public JobEvent withTimestamp(Instant value) {
    return new JobEvent(kind, payload, value);
  }

  public boolean isDone() {
    return kind == EventKind.DONE;
  }
}
