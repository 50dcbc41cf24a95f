package io.github.themoah.logspike.health;

import io.github.themoah.logspike.source.LogSource;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final List<LogSource> sources;

  public HealthCheckHandler(List<LogSource> sources) {
    this.sources = List.copyOf(sources);
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  /**
   * Liveness probe. Always 200 while the server responds.
   */
  private void handleLiveness(RoutingContext ctx) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(HealthCheckResponse.liveness().toJson().encode());
  }

  /**
   * Readiness probe. 503 once any input source has failed.
   */
  private void handleReadiness(RoutingContext ctx) {
    HealthCheckResponse response = HealthCheckResponse.readiness(sources);
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status() == HealthStatus.UP ? 200 : 503)
      .end(response.toJson().encode());
  }
}
