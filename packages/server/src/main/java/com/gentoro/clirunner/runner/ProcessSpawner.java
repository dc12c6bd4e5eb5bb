package com.gentoro.clirunner.runner;

import com.gentoro.clirunner.connector.CommandLine;
import com.gentoro.clirunner.connector.Connector;
import com.gentoro.clirunner.exception.ExceptionUtil;
import com.gentoro.clirunner.exception.LaunchException;
import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.utility.DurationUtility;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Launches the external process of a job and drives the job to a terminal state.
 *
 * <p>Each job gets one supervising task and one output reader task on a daemon thread pool owned
 * by the spawner. The supervisor races process exit against the job's cancellation handle (fired
 * by {@link Job#stop()} or by the deadline) and always closes the job when it is done, which
 * publishes the {@code done} event and ends every stream.
 */
public final class ProcessSpawner implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ProcessSpawner.class);

  private static final int MAX_LOGGED_PAYLOAD = 500;
  private static final int READ_BUFFER_SIZE = 64 * 1024;
  private static final Duration KILL_WAIT = Duration.ofSeconds(5);
  private static final Duration READER_DRAIN_WAIT = Duration.ofSeconds(5);

  private final RunnerSettings settings;
  private final ExecutorService executor;

  public ProcessSpawner(RunnerSettings settings) {
    this.settings = settings;
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("job-runner"));
  }

  /** Start a job with the default timeout. Returns immediately. */
  public void spawn(Job job, Connector connector) {
    spawn(job, connector, settings.defaultTimeout());
  }

  /**
   * Start a job. Returns immediately; launch problems are recorded on the job.
   *
   * @throws LaunchException when the spawner has been shut down; the job is failed and closed
   */
  public void spawn(Job job, Connector connector, Duration timeout) {
    try {
      executor.execute(() -> supervise(job, connector, timeout));
    } catch (RejectedExecutionException e) {
      String message = "runner is shutting down";
      failAndReport(job, 1, message);
      job.close();
      throw new LaunchException("Could not schedule job " + job.id() + ": " + message, e);
    }
  }

  private void supervise(Job job, Connector connector, Duration timeout) {
    String id = job.id();
    Process process = null;
    try {
      CommandLine command = connector.buildCommand(job.prompt());
      if (!job.markRunning()) {
        log.info("Job {} left pending before launch ({}), skipping", id, job.status().wireName());
        if (job.status() == JobStatus.STOPPED) {
          job.appendEvent(JobEvent.of(EventKind.ERROR, JobJson.errorPayload(Job.STOPPED_MESSAGE)));
        }
        return;
      }
      CancellationHandle cancellation = job.cancellation();
      cancellation.armDeadline(timeout);

      ProcessBuilder pb = createProcessBuilder(command, job.workDir());
      log.info(
          "Spawning job {} with connector '{}': {}", id, connector.name(), command.executable());
      try {
        process = pb.start();
      } catch (IOException | RuntimeException e) {
        String message = "failed to start command: " + ExceptionUtil.extractErrorMessage(e);
        log.error("Job {} could not be launched: {}", id, message);
        failAndReport(job, 1, message);
        return;
      }
      job.attachProcess(process);
      log.info("Job {} started (pid {})", id, process.pid());

      final Process running = process;
      Future<IOException> reader = executor.submit(() -> readOutput(job, connector, running));

      CompletableFuture.anyOf(process.onExit(), cancellation.future()).get();

      if (cancellation.isCancelled()) {
        CancellationHandle.Reason reason =
            cancellation.reason().orElse(CancellationHandle.Reason.STOPPED);
        terminate(process);
        awaitReader(job, process, reader);
        String message =
            reason == CancellationHandle.Reason.TIMED_OUT
                ? "Process timed out after " + DurationUtility.format(timeout)
                : Job.STOPPED_MESSAGE;
        JobStatus status = job.finish(JobStatus.STOPPED, JobResult.failure(-1, message));
        if (status == JobStatus.STOPPED) {
          job.appendEvent(JobEvent.of(EventKind.ERROR, JobJson.errorPayload(message)));
        }
        log.warn("Job {} stopped: {}", id, message);
        return;
      }

      int exitCode = process.exitValue();
      IOException readError = awaitReader(job, process, reader);
      if (readError != null) {
        String message =
            "failed to read process output: " + ExceptionUtil.extractErrorMessage(readError);
        log.error("Job {} {}", id, message);
        failAndReport(job, exitCode == 0 ? 1 : exitCode, message);
      } else if (exitCode == 0) {
        job.finish(JobStatus.COMPLETED, JobResult.success(job.lastResultPayload().orElse(null)));
        log.info("Job {} completed", id);
      } else {
        String message = "process exited with code " + exitCode;
        log.warn("Job {} failed: {}", id, message);
        failAndReport(job, exitCode, message);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Supervisor of job {} interrupted, stopping the job", id);
      job.stop();
    } catch (ExecutionException | RuntimeException e) {
      Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
      log.error("Supervisor of job {} failed", id, cause);
      failAndReport(job, 1, ExceptionUtil.extractErrorMessage(cause));
    } finally {
      job.cancellation().disarm();
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      job.close();
      log.debug("Job {} closed with status {}", id, job.status().wireName());
    }
  }

  private static ProcessBuilder createProcessBuilder(CommandLine command, String workDir) {
    ProcessBuilder pb = new ProcessBuilder(command.toList());
    if (workDir != null) {
      pb.directory(new File(workDir));
    }
    pb.redirectErrorStream(true);
    pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
    pb.environment().put("TERM", "dumb");
    return pb;
  }

  /** Reader task body. Returns the read failure, or {@code null} on a clean end of stream. */
  private IOException readOutput(Job job, Connector connector, Process process) {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8),
            READ_BUFFER_SIZE)) {
      String line;
      while ((line = reader.readLine()) != null) {
        handleLine(job, connector, line);
      }
      return null;
    } catch (IOException e) {
      if (job.cancellation().isCancelled()) {
        log.debug("Output of job {} closed after cancellation: {}", job.id(), e.getMessage());
        return null;
      }
      return e;
    }
  }

  private void handleLine(Job job, Connector connector, String line) {
    Optional<JobEvent> event;
    try {
      event = connector.parseLine(line);
    } catch (RuntimeException e) {
      log.warn(
          "Connector '{}' could not parse a line of job {}: {}",
          connector.name(),
          job.id(),
          ExceptionUtil.extractErrorMessage(e));
      return;
    }
    if (event.isEmpty()) {
      return;
    }
    JobEvent e = event.get();
    if (log.isDebugEnabled()) {
      log.debug(
          "Job {} {} event: {}",
          job.id(),
          e.kind().wireName(),
          StringUtils.abbreviate(e.payload(), MAX_LOGGED_PAYLOAD));
    }
    job.appendEvent(e);
  }

  private static void terminate(Process process) throws InterruptedException {
    if (process.isAlive()) {
      process.destroyForcibly();
    }
    if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Process {} still alive {} after kill", process.pid(), KILL_WAIT);
    }
  }

  /**
   * Wait a bounded time for the reader to reach end of stream. A descendant of the tool may keep
   * the pipe open after the tool exits; in that case the stream is closed under the reader.
   */
  private static IOException awaitReader(Job job, Process process, Future<IOException> reader)
      throws InterruptedException {
    try {
      return reader.get(READER_DRAIN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Output of job {} still open after process exit, closing it", job.id());
      try {
        process.getInputStream().close();
      } catch (IOException closeError) {
        log.debug("Closing output of job {} failed: {}", job.id(), closeError.getMessage());
      }
      reader.cancel(true);
      return null;
    } catch (ExecutionException e) {
      return new IOException("output reader failed", e.getCause());
    }
  }

  private static void failAndReport(Job job, int exitCode, String message) {
    JobStatus status = job.finish(JobStatus.FAILED, JobResult.failure(exitCode, message));
    if (status == JobStatus.FAILED) {
      job.appendEvent(JobEvent.of(EventKind.ERROR, JobJson.errorPayload(message)));
    }
  }

  /** Stop accepting jobs and wait briefly for running supervisors to finish. */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Job runner threads still busy after {}, interrupting them", KILL_WAIT);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    DaemonThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
