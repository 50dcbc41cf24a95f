package io.github.themoah.logspike.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes the Prometheus scrape endpoint at /metrics.
 *
 * <p>Answers in OpenMetrics when the scraper asks for it and in the 0.0.4 text format
 * otherwise. Repeated {@code name[]} query parameters limit the output to those sample
 * names, e.g. {@code /metrics?name[]=logspike_store_keys}.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);
  static final String NAME_PARAM = "name[]";

  private final PrometheusMeterRegistry registry;

  public PrometheusHandler(PrometheusMeterRegistry registry) {
    this.registry = registry;
  }

  public void registerRoutes(Router router) {
    router.get("/metrics").handler(this::handleScrape);
    log.info("Registered Prometheus scrape endpoint at /metrics");
  }

  private void handleScrape(RoutingContext ctx) {
    String contentType = TextFormat.chooseContentType(ctx.request().getHeader("accept"));
    List<String> names = ctx.queryParam(NAME_PARAM);
    Set<String> includedNames = names.isEmpty() ? null : new HashSet<>(names);

    String body = registry.scrape(contentType, includedNames);
    log.debug("Serving {} chars of metrics as {} (names: {})", body.length(), contentType,
      includedNames == null ? "all" : includedNames);
    ctx.response()
      .putHeader("content-type", contentType)
      .end(body);
  }
}
