package io.github.themoah.logspike.ingest;

import io.vertx.core.json.JsonObject;
import java.util.Map;

/**
 * Snapshot of ingestion counters.
 *
 * @param succeeded lines that became events
 * @param failed lines that were dropped
 * @param failuresByReason dropped lines per reason value
 */
public record IngestStats(
  long succeeded,
  long failed,
  Map<String, Long> failuresByReason
) {

  public IngestStats {
    failuresByReason = Map.copyOf(failuresByReason);
  }

  public JsonObject toJson() {
    JsonObject reasons = new JsonObject();
    failuresByReason.forEach(reasons::put);
    return new JsonObject()
      .put("succeeded", succeeded)
      .put("failed", failed)
      .put("failuresByReason", reasons);
  }
}
