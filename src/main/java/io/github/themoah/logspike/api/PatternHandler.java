package io.github.themoah.logspike.api;

import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.normalize.FragmentationAnalyzer;
import io.github.themoah.logspike.normalize.FragmentationAnalyzer.FragmentGroup;
import io.github.themoah.logspike.store.PatternStore;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the known pattern keys and the template fragmentation report.
 */
public class PatternHandler {

  private static final Logger log = LoggerFactory.getLogger(PatternHandler.class);

  private final PatternStore store;

  public PatternHandler(PatternStore store) {
    this.store = store;
  }

  public void registerRoutes(Router router) {
    router.get("/patterns").handler(this::handlePatterns);
    router.get("/patterns/fragmented").handler(this::handleFragmented);
    log.info("Pattern routes registered: /patterns, /patterns/fragmented");
  }

  private void handlePatterns(RoutingContext ctx) {
    JsonArray patterns = store.inLock(() -> {
      JsonArray array = new JsonArray();
      for (PatternKey key : store.keys()) {
        Optional<PatternStats> stats = store.stats(key);
        stats.ifPresent(s -> array.add(ApiJson.pattern(key, s)));
      }
      return array;
    });
    Responses.json(ctx, 200, new JsonObject().put("patterns", patterns));
  }

  private void handleFragmented(RoutingContext ctx) {
    Set<String> templates = new LinkedHashSet<>();
    for (PatternKey key : store.keys()) {
      templates.add(key.template());
    }
    List<FragmentGroup> groups = FragmentationAnalyzer.analyze(templates);
    JsonArray array = new JsonArray();
    groups.forEach(g -> array.add(ApiJson.fragmentGroup(g)));
    Responses.json(ctx, 200, new JsonObject()
      .put("templates", templates.size())
      .put("groups", array));
  }
}
