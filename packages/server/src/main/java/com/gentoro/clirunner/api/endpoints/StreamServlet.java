package com.gentoro.clirunner.api.endpoints;

import com.gentoro.clirunner.logging.LoggingService;
import com.gentoro.clirunner.runner.Job;
import com.gentoro.clirunner.runner.JobEvent;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.runner.Subscription;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * GET /stream/{id} — server-sent events: the buffered history first, then live events until the
 * {@code done} event or until the client goes away.
 */
public final class StreamServlet extends JsonServlet {
  private static final Logger log = LoggingService.getLogger(StreamServlet.class);

  private final JobRegistry registry;
  private final Duration heartbeat;

  public StreamServlet(JobRegistry registry, Duration heartbeat) {
    this.registry = registry;
    this.heartbeat = heartbeat;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<Job> found = registry.find(pathId(req));
    if (found.isEmpty()) {
      sendError(resp, 404, "Process not found");
      return;
    }
    Job job = found.get();

    resp.setStatus(200);
    resp.setContentType("text/event-stream");
    resp.setCharacterEncoding("UTF-8");
    resp.setHeader("Cache-Control", "no-cache");
    resp.setHeader("Connection", "keep-alive");
    resp.setHeader("X-Accel-Buffering", "no");
    SseWriter writer = new SseWriter(resp.getOutputStream());
    log.info("SSE stream for process {} started", job.id());

    try {
      for (JobEvent event : job.history()) {
        writer.write(event);
        if (event.isDone()) {
          return;
        }
      }
      streamLive(job, writer);
    } catch (IOException e) {
      log.info("Client of process {} disconnected: {}", job.id(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("SSE stream for process {} interrupted", job.id());
    }
  }

  private void streamLive(Job job, SseWriter writer) throws IOException, InterruptedException {
    try (Subscription subscription = job.subscribe(UUID.randomUUID().toString())) {
      while (true) {
        JobEvent event = subscription.poll(heartbeat);
        if (event != null) {
          writer.write(event);
          if (event.isDone()) {
            log.info("Process {} done, closing stream", job.id());
            return;
          }
        } else if (subscription.isDrained()) {
          // Closed before the done event reached this subscriber; it is still in the history.
          writeFinalEvent(job, writer);
          return;
        } else {
          writer.comment("keep-alive");
        }
      }
    }
  }

  private static void writeFinalEvent(Job job, SseWriter writer) throws IOException {
    List<JobEvent> history = job.history();
    if (!history.isEmpty() && history.get(history.size() - 1).isDone()) {
      writer.write(history.get(history.size() - 1));
    }
  }
}
