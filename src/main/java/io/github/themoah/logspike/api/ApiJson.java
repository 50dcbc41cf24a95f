package io.github.themoah.logspike.api;

import io.github.themoah.logspike.detect.Severity;
import io.github.themoah.logspike.detect.SeverityThresholds;
import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.AnomalyContext;
import io.github.themoah.logspike.model.DeployEvent;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.model.NearMiss;
import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.normalize.FragmentationAnalyzer.FragmentGroup;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;

/**
 * JSON views of the domain types served over HTTP.
 */
final class ApiJson {

  private ApiJson() {
  }

  static JsonObject key(PatternKey key) {
    return new JsonObject()
      .put("service", key.service())
      .put("level", key.level())
      .put("template", key.template());
  }

  static JsonObject anomaly(int rank, Anomaly anomaly, SeverityThresholds thresholds) {
    return key(anomaly.key())
      .put("rank", rank)
      .put("reason", anomaly.reason().getValue())
      .put("severity", anomaly.severity())
      .put("severityLabel", Severity.of(anomaly.severity(), thresholds).name())
      .put("recentWeighted", anomaly.recentWeighted())
      .put("baselineWeighted", anomaly.baselineWeighted())
      .put("firstSeen", instant(anomaly.firstSeen()))
      .put("lastSeen", instant(anomaly.lastSeen()));
  }

  static JsonObject nearMiss(NearMiss nearMiss) {
    return key(nearMiss.key())
      .put("recentWeighted", nearMiss.recentWeighted())
      .put("baselineWeighted", nearMiss.baselineWeighted())
      .put("threshold", nearMiss.threshold());
  }

  static JsonObject detection(DetectionResult result, SeverityThresholds thresholds) {
    JsonArray anomalies = new JsonArray();
    List<Anomaly> ranked = result.anomalies();
    for (int i = 0; i < ranked.size(); i++) {
      anomalies.add(anomaly(i + 1, ranked.get(i), thresholds));
    }
    JsonArray nearMisses = new JsonArray();
    result.nearMisses().forEach(n -> nearMisses.add(nearMiss(n)));
    return new JsonObject()
      .put("detectedAt", instant(result.detectedAt()))
      .put("anomalies", anomalies)
      .put("nearMisses", nearMisses);
  }

  static JsonObject context(int rank, AnomalyContext ctx, SeverityThresholds thresholds) {
    JsonArray related = new JsonArray();
    ctx.relatedPatterns().forEach((key, count) -> related.add(key(key).put("count", count)));
    JsonObject levels = new JsonObject();
    ctx.levelBreakdown().forEach(levels::put);

    return new JsonObject()
      .put("anomaly", anomaly(rank, ctx.anomaly(), thresholds))
      .put("windowStart", instant(ctx.windowStart()))
      .put("windowEnd", instant(ctx.windowEnd()))
      .put("relatedPatterns", related)
      .put("levelBreakdown", levels)
      .put("deployEvent", ctx.deployEvent() == null ? null : deploy(ctx.deployEvent()))
      .put("requestIds", new JsonArray(List.copyOf(ctx.requestIds())));
  }

  static JsonObject deploy(DeployEvent deploy) {
    return new JsonObject()
      .put("service", deploy.service())
      .put("version", deploy.version())
      .put("timestamp", instant(deploy.timestamp()));
  }

  static JsonObject pattern(PatternKey key, PatternStats stats) {
    return key(key)
      .put("totalCount", stats.totalCount())
      .put("firstSeen", instant(stats.firstSeen()))
      .put("lastSeen", instant(stats.lastSeen()));
  }

  static JsonObject fragmentGroup(FragmentGroup group) {
    return new JsonObject()
      .put("shape", group.shape())
      .put("templates", new JsonArray(List.copyOf(group.templates())));
  }

  static JsonObject error(String message) {
    return new JsonObject().put("error", message);
  }

  private static String instant(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
