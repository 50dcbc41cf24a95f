package io.github.themoah.logspike.api;

import io.github.themoah.logspike.source.IngestPipeline;
import io.github.themoah.logspike.source.IngestPipeline.BatchResult;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts log lines over HTTP and serves ingest counters.
 */
public class IngestHandler {

  private static final Logger log = LoggerFactory.getLogger(IngestHandler.class);

  static final long MAX_BODY_BYTES = 16L * 1024 * 1024;

  private final IngestPipeline pipeline;

  public IngestHandler(IngestPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public void registerRoutes(Router router) {
    router.post("/ingest").handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));
    router.post("/ingest").handler(this::handleIngest);
    router.get("/stats").handler(this::handleStats);
    log.info("Ingest routes registered: POST /ingest, GET /stats");
  }

  private void handleIngest(RoutingContext ctx) {
    String body = ctx.body().asString();
    BatchResult result = pipeline.acceptAll(body);
    log.debug("Ingested batch over HTTP: accepted={}, rejected={}", result.accepted(), result.rejected());
    Responses.json(ctx, 200, new JsonObject()
      .put("accepted", result.accepted())
      .put("rejected", result.rejected()));
  }

  private void handleStats(RoutingContext ctx) {
    Responses.json(ctx, 200, pipeline.ingestor().stats().toJson()
      .put("patterns", pipeline.store().size()));
  }
}
