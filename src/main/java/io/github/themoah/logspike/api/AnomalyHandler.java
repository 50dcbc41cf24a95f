package io.github.themoah.logspike.api;

import io.github.themoah.logspike.context.ContextBuilder;
import io.github.themoah.logspike.context.DeployRegistry;
import io.github.themoah.logspike.detect.DetectionScheduler;
import io.github.themoah.logspike.explain.AnomalyExplainer;
import io.github.themoah.logspike.explain.MalformedExplanationException;
import io.github.themoah.logspike.ingest.TimestampParser;
import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.AnomalyContext;
import io.github.themoah.logspike.model.DeployEvent;
import io.github.themoah.logspike.model.DetectionResult;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves detection results, anomaly context and explanations.
 *
 * <p>Anomalies are addressed by 1-based rank in the latest detection result, rank 1 being
 * the most severe.
 */
public class AnomalyHandler {

  private static final Logger log = LoggerFactory.getLogger(AnomalyHandler.class);

  private final DetectionScheduler scheduler;
  private final ContextBuilder contextBuilder;
  private final DeployRegistry deploys;
  private final AnomalyExplainer explainer;

  /**
   * @param explainer explanation collaborator, or null when none is configured
   */
  public AnomalyHandler(
    DetectionScheduler scheduler,
    ContextBuilder contextBuilder,
    DeployRegistry deploys,
    AnomalyExplainer explainer
  ) {
    this.scheduler = scheduler;
    this.contextBuilder = contextBuilder;
    this.deploys = deploys;
    this.explainer = explainer;
  }

  public void registerRoutes(Router router) {
    router.get("/anomalies").handler(this::handleAnomalies);
    router.get("/anomalies/:rank/context").handler(this::handleContext);
    router.post("/anomalies/:rank/explain").handler(this::handleExplain);
    router.post("/deploys").handler(BodyHandler.create());
    router.post("/deploys").handler(this::handleDeploy);
    log.info("Anomaly routes registered: /anomalies, /anomalies/:rank/context, /anomalies/:rank/explain, /deploys");
  }

  private void handleAnomalies(RoutingContext ctx) {
    DetectionResult result = scheduler.latest();
    if (result == null) {
      Responses.error(ctx, 404, "No detection has run yet");
      return;
    }
    Responses.json(ctx, 200, ApiJson.detection(result, scheduler.thresholds()));
  }

  private void handleContext(RoutingContext ctx) {
    int rank = Responses.rank(ctx);
    Optional<Anomaly> anomaly = resolve(ctx, rank);
    if (anomaly.isEmpty()) {
      return;
    }
    AnomalyContext context = contextBuilder.build(anomaly.get(), deploys.snapshot());
    Responses.json(ctx, 200, ApiJson.context(rank, context, scheduler.thresholds()));
  }

  private void handleExplain(RoutingContext ctx) {
    if (explainer == null) {
      Responses.error(ctx, 404, "No explainer configured");
      return;
    }
    int rank = Responses.rank(ctx);
    Optional<Anomaly> anomaly = resolve(ctx, rank);
    if (anomaly.isEmpty()) {
      return;
    }
    AnomalyContext context = contextBuilder.build(anomaly.get(), deploys.snapshot());
    explainer.explain(context)
      .onSuccess(explanation -> Responses.json(ctx, 200, new JsonObject()
        .put("anomaly", ApiJson.anomaly(rank, anomaly.get(), scheduler.thresholds()))
        .put("explanation", explanation.toJson())))
      .onFailure(err -> {
        if (err instanceof MalformedExplanationException) {
          Responses.error(ctx, 502, "Malformed explanation: " + err.getMessage());
        } else {
          log.error("Explanation failed for rank {}", rank, err);
          Responses.error(ctx, 502, "Explanation failed: " + err.getMessage());
        }
      });
  }

  private void handleDeploy(RoutingContext ctx) {
    String service;
    String version;
    Object rawTimestamp;
    try {
      JsonObject body = ctx.body().asJsonObject();
      if (body == null) {
        Responses.error(ctx, 400, "Body must be a JSON object");
        return;
      }
      service = body.getString("service");
      version = body.getString("version", "unknown");
      rawTimestamp = body.getValue("timestamp");
    } catch (DecodeException | ClassCastException e) {
      log.debug("Rejected deploy registration: {}", e.getMessage());
      Responses.error(ctx, 400, "Body must be a JSON object with string fields");
      return;
    }
    Optional<Instant> timestamp = rawTimestamp == null
      ? Optional.of(Instant.now())
      : TimestampParser.parse(rawTimestamp);
    if (service == null || service.isBlank() || timestamp.isEmpty()) {
      Responses.error(ctx, 400, "Fields 'service' and a valid 'timestamp' are required");
      return;
    }
    DeployEvent event = new DeployEvent(service, version, timestamp.get());
    deploys.register(event);
    Responses.json(ctx, 201, ApiJson.deploy(event));
  }

  /**
   * Looks up the anomaly at a rank, writing an error response if there is none.
   */
  private Optional<Anomaly> resolve(RoutingContext ctx, int rank) {
    if (rank < 1) {
      Responses.error(ctx, 400, "Rank must be a positive integer");
      return Optional.empty();
    }
    DetectionResult result = scheduler.latest();
    if (result == null || rank > result.anomalies().size()) {
      Responses.error(ctx, 404, "No anomaly at rank " + rank);
      return Optional.empty();
    }
    return Optional.of(result.anomalies().get(rank - 1));
  }
}
