package io.github.themoah.logspike.context;

import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.AnomalyContext;
import io.github.themoah.logspike.model.DeployEvent;
import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.RequestSample;
import io.github.themoah.logspike.store.PatternStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gathers the activity surrounding an anomaly.
 *
 * <p>The context window ends at the anomaly's last occurrence and spans
 * {@code contextWindow} back from there. Bucket counts are attributed by bucket start, so
 * a bucket that started before the window contributes nothing.
 */
public class ContextBuilder {

  private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

  public static final Duration DEFAULT_CONTEXT_WINDOW = Duration.ofMinutes(5);

  private final PatternStore store;
  private final Duration contextWindow;

  public ContextBuilder(PatternStore store) {
    this(store, DEFAULT_CONTEXT_WINDOW);
  }

  public ContextBuilder(PatternStore store, Duration contextWindow) {
    if (contextWindow == null || contextWindow.isNegative()) {
      throw new IllegalArgumentException("contextWindow must not be negative, got " + contextWindow);
    }
    this.store = store;
    this.contextWindow = contextWindow;
  }

  /**
   * Builds the context of an anomaly without deploy correlation.
   */
  public AnomalyContext build(Anomaly anomaly) {
    return build(anomaly, List.of());
  }

  /**
   * Builds the context of an anomaly.
   *
   * @param anomaly the anomaly, which must carry a last-seen time
   * @param deployEvents known deployments, in the order they should be matched; may be null
   */
  public AnomalyContext build(Anomaly anomaly, List<DeployEvent> deployEvents) {
    if (anomaly.lastSeen() == null) {
      throw new IllegalArgumentException("Anomaly has no last-seen time: " + anomaly.key());
    }
    Instant windowEnd = anomaly.lastSeen();
    Instant windowStart = windowEnd.minus(contextWindow);

    Map<PatternKey, Long> activity = store.activityWindow(windowStart, windowEnd);
    String service = anomaly.key().service();

    Map<PatternKey, Long> related = new LinkedHashMap<>();
    Map<String, Long> levels = new LinkedHashMap<>();
    for (Map.Entry<PatternKey, Long> entry : activity.entrySet()) {
      PatternKey key = entry.getKey();
      if (key.service().equals(service) && !key.equals(anomaly.key())) {
        related.put(key, entry.getValue());
      }
      levels.merge(key.level(), entry.getValue(), Long::sum);
    }

    DeployEvent deploy = findDeploy(service, deployEvents, windowStart, windowEnd);
    List<String> requestIds = requestIdsInWindow(anomaly.key(), windowStart, windowEnd);

    log.debug("Built context for {}: window=[{}, {}], related={}, deploy={}",
      anomaly.key(), windowStart, windowEnd, related.size(), deploy != null ? deploy.version() : "none");

    return new AnomalyContext(
      anomaly,
      windowStart,
      windowEnd,
      Collections.unmodifiableMap(related),
      Collections.unmodifiableMap(levels),
      deploy,
      List.copyOf(requestIds)
    );
  }

  private DeployEvent findDeploy(String service, List<DeployEvent> deployEvents, Instant start, Instant end) {
    if (deployEvents == null) {
      return null;
    }
    for (DeployEvent deploy : deployEvents) {
      if (deploy.service().equals(service)
          && !deploy.timestamp().isBefore(start)
          && !deploy.timestamp().isAfter(end)) {
        return deploy;
      }
    }
    return null;
  }

  private List<String> requestIdsInWindow(PatternKey key, Instant start, Instant end) {
    Set<String> ids = new LinkedHashSet<>();
    for (RequestSample sample : store.requestSamples(key)) {
      if (!sample.timestamp().isBefore(start) && !sample.timestamp().isAfter(end)) {
        ids.add(sample.requestId());
      }
    }
    return new ArrayList<>(ids);
  }

  public Duration contextWindow() {
    return contextWindow;
  }
}
