package com.gentoro.clirunner.api.endpoints;

import com.gentoro.clirunner.runner.JobJson;
import com.gentoro.clirunner.runner.JobRegistry;
import com.gentoro.clirunner.utility.DurationUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/**
 * GET /result-data/{id} — the cached payload of the job's last {@code result} event. Served until
 * the cache entry expires, even after the job itself has been evicted.
 */
public final class ResultDataServlet extends JsonServlet {
  private final JobRegistry registry;

  public ResultDataServlet(JobRegistry registry) {
    this.registry = registry;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String id = pathId(req);
    Optional<String> payload = id == null ? Optional.empty() : registry.cachedResult(id);
    if (payload.isEmpty()) {
      sendError(
          resp,
          404,
          "Result data not found or expired",
          "Result data is only cached for "
              + DurationUtility.format(registry.settings().resultCacheTtl()));
      return;
    }
    sendJson(resp, 200, JobJson.payloadNode(payload.get()));
  }
}
