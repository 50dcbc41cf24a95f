package io.github.themoah.logspike.api;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Helpers for writing JSON responses.
 */
final class Responses {

  static final String CONTENT_TYPE_JSON = "application/json";

  private Responses() {
  }

  static void json(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }

  static void error(RoutingContext ctx, int status, String message) {
    json(ctx, status, ApiJson.error(message));
  }

  /**
   * Parses a 1-based rank path parameter.
   *
   * @return the rank, or -1 if the parameter is not a positive integer
   */
  static int rank(RoutingContext ctx) {
    String value = ctx.pathParam("rank");
    try {
      int rank = Integer.parseInt(value);
      return rank > 0 ? rank : -1;
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
