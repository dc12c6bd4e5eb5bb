package com.gentoro.clirunner.runner;

import java.time.Instant;

/** Consistent, immutable view of a job's state at one point in time. */
public record JobSnapshot(
    String id,
    String connector,
    String prompt,
    String workDir,
    JobStatus status,
    Instant startedAt,
    Instant completedAt,
    JobResult result) {}
