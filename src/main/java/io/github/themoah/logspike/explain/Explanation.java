package io.github.themoah.logspike.explain;

import io.vertx.core.json.JsonObject;

/**
 * Structured narrative explanation of an anomaly.
 *
 * @param summary one-paragraph summary
 * @param whyItMatters why the anomaly is worth attention
 * @param whereToLook areas to investigate, one per line
 * @param confidence self-reported confidence between 0 and 1
 */
public record Explanation(
  String summary,
  String whyItMatters,
  String whereToLook,
  double confidence
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("summary", summary)
      .put("whyItMatters", whyItMatters)
      .put("whereToLook", whereToLook)
      .put("confidence", confidence);
  }
}
