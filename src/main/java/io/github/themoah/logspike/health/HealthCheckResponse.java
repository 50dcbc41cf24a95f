package io.github.themoah.logspike.health;

import io.github.themoah.logspike.source.LogSource;
import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable health check response.
 *
 * @param status overall status
 * @param sources status per input source name (null for liveness)
 */
public record HealthCheckResponse(
  HealthStatus status,
  Map<String, HealthStatus> sources
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Readiness is UP only if every source is healthy. No sources counts as ready.
   */
  public static HealthCheckResponse readiness(List<LogSource> sources) {
    Map<String, HealthStatus> statuses = new LinkedHashMap<>();
    boolean allHealthy = true;
    for (LogSource source : sources) {
      boolean healthy = source.isHealthy();
      statuses.put(source.name(), HealthStatus.of(healthy));
      allHealthy &= healthy;
    }
    return new HealthCheckResponse(HealthStatus.of(allHealthy), statuses);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (sources != null) {
      JsonObject sourcesJson = new JsonObject();
      sources.forEach((name, s) -> sourcesJson.put(name, s.getValue()));
      json.put("sources", sourcesJson);
    }
    return json;
  }
}
