package com.gentoro.clirunner.runner;

import java.time.Instant;

/** Payload of the last {@code result} event of a job, valid until {@code expiresAt}. */
public record CachedResult(String payload, Instant expiresAt) {

  public boolean isValidAt(Instant now) {
    return now.isBefore(expiresAt);
  }
}
