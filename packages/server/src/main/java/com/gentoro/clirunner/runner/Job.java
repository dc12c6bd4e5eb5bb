package com.gentoro.clirunner.runner;

import com.gentoro.clirunner.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * One managed invocation of an external command: its descriptive attributes, lifecycle state,
 * bounded event history, live subscribers, final result and result cache.
 *
 * <p>All mutable state is guarded by a single per-job lock. Status changes only move forward
 * through {@code PENDING -> RUNNING -> COMPLETED | FAILED | STOPPED}; once terminal, status,
 * {@code completedAt} and result never change again.
 *
 * <p>The lifecycle methods ({@link #markRunning()}, {@link #attachProcess(Process)}, {@link
 * #finish(JobStatus, JobResult)}, {@link #close()}) are driven by {@link ProcessSpawner}. Request
 * handlers use {@link #stop()}, {@link #subscribe(String)} and the read accessors.
 */
public final class Job {
  private static final Logger log = LoggingService.getLogger(Job.class);

  static final String STOPPED_MESSAGE = "Process stopped";

  private final String id;
  private final String connector;
  private final String prompt;
  private final String workDir;
  private final Instant startedAt;

  private final Clock clock;
  private final Duration resultCacheTtl;
  private final int subscriberCapacity;

  private final RingBuffer<JobEvent> events;
  private final CancellationHandle cancellation = new CancellationHandle();

  private final Object lock = new Object();
  private final Map<String, SubscriberChannel> subscribers = new LinkedHashMap<>();
  private JobStatus status = JobStatus.PENDING;
  private Instant completedAt;
  private JobResult result;
  private CachedResult cachedResult;
  private String lastResultPayload;
  private Process process;
  private boolean closed;

  Job(
      String id,
      String connector,
      String prompt,
      String workDir,
      RunnerSettings settings,
      Clock clock) {
    this.id = id;
    this.connector = connector;
    this.prompt = prompt;
    this.workDir = workDir == null || workDir.isBlank() ? null : workDir;
    this.clock = clock;
    this.startedAt = clock.instant();
    this.resultCacheTtl = settings.resultCacheTtl();
    this.subscriberCapacity = settings.subscriberCapacity();
    this.events = new RingBuffer<>(settings.bufferSize());
  }

  public String id() {
    return id;
  }

  public String connector() {
    return connector;
  }

  public String prompt() {
    return prompt;
  }

  /** Working directory for the process, or {@code null} to inherit the server's. */
  public String workDir() {
    return workDir;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public JobStatus status() {
    synchronized (lock) {
      return status;
    }
  }

  public Optional<Instant> completedAt() {
    synchronized (lock) {
      return Optional.ofNullable(completedAt);
    }
  }

  public Optional<JobResult> result() {
    synchronized (lock) {
      return Optional.ofNullable(result);
    }
  }

  public JobSnapshot snapshot() {
    synchronized (lock) {
      return new JobSnapshot(
          id, connector, prompt, workDir, status, startedAt, completedAt, result);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Events and subscribers
  // ---------------------------------------------------------------------------------------------

  /**
   * Append an event to the history and offer it to every subscriber without blocking. The event
   * is stamped with the job's clock so that the history stays in order. A {@code result} event
   * also refreshes the result cache. Events appended after {@link #close()} are ignored.
   */
  public void appendEvent(JobEvent event) {
    synchronized (lock) {
      if (closed) {
        log.debug("Job {} is closed, ignoring {} event", id, event.kind().wireName());
        return;
      }
      publish(event.withTimestamp(clock.instant()));
    }
  }

  private void publish(JobEvent event) {
    events.push(event);
    for (Map.Entry<String, SubscriberChannel> entry : subscribers.entrySet()) {
      if (!entry.getValue().offer(event)) {
        log.debug(
            "Subscriber {} of job {} is full, dropped {} event",
            entry.getKey(),
            id,
            event.kind().wireName());
      }
    }
    if (event.kind() == EventKind.RESULT) {
      lastResultPayload = event.payload();
      cachedResult = new CachedResult(event.payload(), clock.instant().plus(resultCacheTtl));
    }
  }

  /** Buffered history, oldest first. */
  public List<JobEvent> history() {
    return events.snapshot();
  }

  /**
   * Register a live subscriber. History is not replayed here: callers read {@link #history()}
   * first and then consume the subscription, accepting that a few events around the boundary may
   * be seen twice. Subscribing to a closed job yields an already-drained subscription.
   */
  public Subscription subscribe(String subscriberId) {
    SubscriberChannel channel = new SubscriberChannel(subscriberCapacity);
    synchronized (lock) {
      if (closed) {
        channel.close();
      } else {
        SubscriberChannel previous = subscribers.put(subscriberId, channel);
        if (previous != null) {
          previous.close();
        }
      }
    }
    return new Subscription(this, subscriberId, channel);
  }

  /** Remove and close a subscriber. Idempotent. */
  public void unsubscribe(String subscriberId) {
    synchronized (lock) {
      SubscriberChannel channel = subscribers.remove(subscriberId);
      if (channel != null) {
        channel.close();
      }
    }
  }

  public int subscriberCount() {
    synchronized (lock) {
      return subscribers.size();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Result cache
  // ---------------------------------------------------------------------------------------------

  /** Payload of the last {@code result} event while it is younger than the cache TTL. */
  public Optional<String> cachedResultPayload() {
    synchronized (lock) {
      if (cachedResult == null || !cachedResult.isValidAt(clock.instant())) {
        return Optional.empty();
      }
      return Optional.of(cachedResult.payload());
    }
  }

  Optional<CachedResult> cachedResult() {
    synchronized (lock) {
      return Optional.ofNullable(cachedResult);
    }
  }

  /** Last {@code result} payload regardless of cache expiry; used as the job's result output. */
  Optional<String> lastResultPayload() {
    synchronized (lock) {
      return Optional.ofNullable(lastResultPayload);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Lifecycle
  // ---------------------------------------------------------------------------------------------

  public CancellationHandle cancellation() {
    return cancellation;
  }

  /** {@code PENDING -> RUNNING}. Returns {@code false} if the job already left {@code PENDING}. */
  public boolean markRunning() {
    synchronized (lock) {
      if (status != JobStatus.PENDING) {
        return false;
      }
      status = JobStatus.RUNNING;
      return true;
    }
  }

  /** Remember the OS process so that {@link #stop()} can terminate it. */
  public void attachProcess(Process process) {
    synchronized (lock) {
      this.process = process;
    }
  }

  /**
   * Enter a terminal state. When the job is already terminal (for instance stopped by a request
   * handler) the existing status, timestamp and result are kept.
   *
   * @return the job's status after the call
   */
  public JobStatus finish(JobStatus terminal, JobResult outcome) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal status: " + terminal);
    }
    synchronized (lock) {
      if (!status.isTerminal()) {
        status = terminal;
        completedAt = clock.instant();
        result = outcome;
      }
      return status;
    }
  }

  /**
   * Request cancellation: fires the cancellation handle, destroys the OS process if one is
   * attached and, if the job is not yet terminal, moves it to {@code STOPPED}. Idempotent.
   *
   * @return {@code true} if this call moved the job to {@code STOPPED}
   */
  public boolean stop() {
    synchronized (lock) {
      cancellation.cancel(CancellationHandle.Reason.STOPPED);
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      if (status.isTerminal()) {
        return false;
      }
      status = JobStatus.STOPPED;
      completedAt = clock.instant();
      result = JobResult.failure(-1, STOPPED_MESSAGE);
      return true;
    }
  }

  /**
   * Final step of every run, executed once: publishes the {@code done} event carrying the final
   * status and result, closes every subscriber after the event is queued, and releases the process
   * handle. A job that is somehow still active is failed first.
   */
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      if (!status.isTerminal()) {
        status = JobStatus.FAILED;
        completedAt = clock.instant();
        result = JobResult.failure(1, "Job closed before reaching a terminal state");
      }
      publish(
          new JobEvent(
              EventKind.DONE, JobJson.donePayload(id, status, result), clock.instant()));
      closed = true;
      List<SubscriberChannel> channels = new ArrayList<>(subscribers.values());
      subscribers.clear();
      channels.forEach(SubscriberChannel::close);
      process = null;
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /** Terminal, and completed at least {@code retention} before {@code now}. */
  boolean isExpired(Instant now, Duration retention) {
    synchronized (lock) {
      return status.isTerminal()
          && completedAt != null
          && !completedAt.plus(retention).isAfter(now);
    }
  }
}
