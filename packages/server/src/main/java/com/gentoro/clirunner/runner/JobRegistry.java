package com.gentoro.clirunner.runner;

import com.gentoro.clirunner.exception.AdmissionException;
import com.gentoro.clirunner.exception.ConflictException;
import com.gentoro.clirunner.exception.NotFoundException;
import com.gentoro.clirunner.logging.LoggingService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * In-memory table of all jobs known to the service.
 *
 * <p>Admission is checked and the new job inserted under the registry lock, so the number of
 * pending or running jobs never exceeds {@link RunnerSettings#maxConcurrent()}. Terminal jobs are
 * evicted by a periodic sweep once they have been terminal for {@link
 * RunnerSettings#cleanupDelay()}. A still-valid result cache slot outlives its job in a
 * retained-results table until it expires.
 */
public final class JobRegistry implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobRegistry.class);

  private final RunnerSettings settings;
  private final Clock clock;

  private final Object lock = new Object();
  private final Map<String, Job> jobs = new LinkedHashMap<>();
  private final Map<String, CachedResult> retainedResults = new HashMap<>();

  private ScheduledExecutorService sweeper;

  public JobRegistry(RunnerSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public JobRegistry(RunnerSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  public RunnerSettings settings() {
    return settings;
  }

  /**
   * Admit and register a new job in {@code PENDING}.
   *
   * @throws AdmissionException when the concurrency ceiling is reached; nothing is registered
   */
  public Job create(String connector, String prompt, String workDir) {
    synchronized (lock) {
      int active = countActive();
      if (active >= settings.maxConcurrent()) {
        log.warn(
            "Rejecting job for connector '{}': {} of {} slots in use",
            connector,
            active,
            settings.maxConcurrent());
        throw new AdmissionException(
            "too many concurrent jobs (limit %d)".formatted(settings.maxConcurrent()));
      }
      String id = UUID.randomUUID().toString();
      Job job = new Job(id, connector, prompt, workDir, settings, clock);
      jobs.put(id, job);
      log.debug("Registered job {} for connector '{}'", id, connector);
      return job;
    }
  }

  public Job get(String id) {
    return find(id).orElseThrow(() -> new NotFoundException("process not found: " + id));
  }

  public Optional<Job> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    synchronized (lock) {
      return Optional.ofNullable(jobs.get(id));
    }
  }

  /** Jobs in registration order, as of the call. */
  public List<Job> list() {
    synchronized (lock) {
      return new ArrayList<>(jobs.values());
    }
  }

  /**
   * Stop a job. Stopping a terminal job has no effect.
   *
   * @return {@code true} if the job was moved to {@code STOPPED} by this call
   */
  public boolean stop(String id) {
    Job job = get(id);
    boolean stopped = job.stop();
    if (stopped) {
      log.info("Job {} stopped on request", id);
    }
    return stopped;
  }

  /**
   * Remove a terminal job from the table.
   *
   * @throws NotFoundException when no such job exists
   * @throws ConflictException when the job is still pending or running
   */
  public void remove(String id) {
    synchronized (lock) {
      Job job = jobs.get(id);
      if (job == null) {
        throw new NotFoundException("process not found: " + id);
      }
      if (!job.status().isTerminal()) {
        throw new ConflictException(
            "process %s is still %s".formatted(id, job.status().wireName()));
      }
      jobs.remove(id);
      retain(job, clock.instant());
    }
    log.debug("Job {} removed", id);
  }

  public int activeCount() {
    synchronized (lock) {
      return countActive();
    }
  }

  public int size() {
    synchronized (lock) {
      return jobs.size();
    }
  }

  /**
   * Unexpired {@code result} payload for a job, looked up on the live job first and then among
   * the results retained from evicted jobs.
   */
  public Optional<String> cachedResult(String id) {
    Optional<Job> job = find(id);
    if (job.isPresent()) {
      return job.get().cachedResultPayload();
    }
    Instant now = clock.instant();
    synchronized (lock) {
      CachedResult retained = retainedResults.get(id);
      if (retained == null || !retained.isValidAt(now)) {
        return Optional.empty();
      }
      return Optional.of(retained.payload());
    }
  }

  /** Start the periodic eviction sweep. Calling it again has no effect. */
  public void startCleanup() {
    synchronized (lock) {
      if (sweeper != null) {
        return;
      }
      sweeper =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "job-registry-sweeper");
                t.setDaemon(true);
                return t;
              });
      long periodMillis = settings.cleanupInterval().toMillis();
      sweeper.scheduleAtFixedRate(
          this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }
    log.info(
        "Cleanup sweep every {} ms, retention {} ms",
        settings.cleanupInterval().toMillis(),
        settings.cleanupDelay().toMillis());
  }

  private void sweepSafely() {
    try {
      cleanup();
    } catch (RuntimeException e) {
      // An exception would cancel the scheduled task.
      log.error("Cleanup sweep failed", e);
    }
  }

  /**
   * One sweep tick: evicts every job terminal for at least the retention period and purges
   * expired retained results.
   *
   * @return the number of evicted jobs
   */
  int cleanup() {
    Instant now = clock.instant();
    int removed = 0;
    synchronized (lock) {
      Iterator<Map.Entry<String, Job>> it = jobs.entrySet().iterator();
      while (it.hasNext()) {
        Job job = it.next().getValue();
        if (job.isExpired(now, settings.cleanupDelay())) {
          it.remove();
          retain(job, now);
          removed++;
        }
      }
      retainedResults.values().removeIf(cached -> !cached.isValidAt(now));
    }
    if (removed > 0) {
      log.debug("Cleanup sweep evicted {} job(s)", removed);
    }
    return removed;
  }

  int retainedResultCount() {
    synchronized (lock) {
      return retainedResults.size();
    }
  }

  private void retain(Job job, Instant now) {
    job.cachedResult()
        .filter(cached -> cached.isValidAt(now))
        .ifPresent(cached -> retainedResults.put(job.id(), cached));
  }

  private int countActive() {
    int active = 0;
    for (Job job : jobs.values()) {
      if (!job.status().isTerminal()) {
        active++;
      }
    }
    return active;
  }

  /** Stop the sweep and every job that is still pending or running. */
  @Override
  public void close() {
    ScheduledExecutorService s;
    List<Job> snapshot;
    synchronized (lock) {
      s = sweeper;
      sweeper = null;
      snapshot = new ArrayList<>(jobs.values());
    }
    if (s != null) {
      s.shutdownNow();
    }
    int stopped = 0;
    for (Job job : snapshot) {
      if (job.stop()) {
        stopped++;
      }
    }
    if (stopped > 0) {
      log.info("Stopped {} active job(s) on shutdown", stopped);
    }
  }
}
