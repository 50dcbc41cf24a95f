package io.github.themoah.logspike.metrics;

import io.github.themoah.logspike.detect.Severity;
import io.github.themoah.logspike.detect.SeverityThresholds;
import io.github.themoah.logspike.ingest.IngestStats;
import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.model.PatternKey;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using a Micrometer MeterRegistry.
 *
 * <p>Per-anomaly severity gauges come and go with the anomalies. A gauge missing from one
 * detection pass is marked, and removed only if it is still missing in the next one.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String INGEST_SUCCEEDED = "logspike.ingest.succeeded";
  static final String INGEST_FAILED = "logspike.ingest.failed";
  static final String STORE_KEYS = "logspike.store.keys";
  static final String ANOMALIES = "logspike.anomalies";
  static final String NEAR_MISSES = "logspike.near_misses";
  static final String ANOMALY_SEVERITY = "logspike.anomaly.severity";

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportIngest(IngestStats stats) {
    recordGauge(INGEST_SUCCEEDED, Tags.empty(), stats.succeeded());
    recordGauge(INGEST_FAILED, Tags.of("reason", "all"), stats.failed());
    stats.failuresByReason().forEach((reason, count) ->
      recordGauge(INGEST_FAILED, Tags.of("reason", reason), count));
  }

  @Override
  public void reportDetection(DetectionResult result, SeverityThresholds thresholds, int storeKeys) {
    log.debug("Reporting detection metrics: {} anomalies, {} near-misses",
      result.anomalies().size(), result.nearMisses().size());

    recordGauge(STORE_KEYS, Tags.empty(), storeKeys);
    recordGauge(NEAR_MISSES, Tags.empty(), result.nearMisses().size());

    Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      bySeverity.put(severity, 0L);
    }

    Set<String> activeKeys = new HashSet<>();
    for (Anomaly anomaly : result.anomalies()) {
      Severity severity = Severity.of(anomaly.severity(), thresholds);
      bySeverity.merge(severity, 1L, Long::sum);

      PatternKey key = anomaly.key();
      Tags tags = Tags.of(
        "service", key.service(),
        "level", key.level(),
        "reason", anomaly.reason().getValue(),
        "template", key.template()
      );
      activeKeys.add(recordDoubleGauge(ANOMALY_SEVERITY, tags, anomaly.severity()));
    }
    bySeverity.forEach((severity, count) ->
      recordGauge(ANOMALIES, Tags.of("severity", severity.toMetricValue()), count));

    cleanupStaleGauges(ANOMALY_SEVERITY, activeKeys);
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private String recordGauge(String name, Tags tags, long value) {
    String key = name + tags;
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      gauges.put(k, Gauge.builder(name, newValue, AtomicLong::get).tags(tags).register(registry));
      return newValue;
    });
    holder.set(value);
    return key;
  }

  private String recordDoubleGauge(String name, Tags tags, double value) {
    String key = name + tags;
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(Double.doubleToLongBits(value));
      gauges.put(k, Gauge.builder(name, newValue, v -> Double.longBitsToDouble(v.get()))
        .tags(tags)
        .register(registry));
      return newValue;
    });
    holder.set(Double.doubleToLongBits(value));
    return key;
  }

  /**
   * Two-phase cleanup for gauges of one metric name.
   * Phase 1 marks gauges missing from this pass; phase 2 removes gauges that were marked
   * in the previous pass and are still missing.
   *
   * @param name metric name whose gauges are subject to cleanup
   * @param activeKeys gauge keys updated in the current pass
   */
  void cleanupStaleGauges(String name, Set<String> activeKeys) {
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activeKeys);
    for (String key : toDelete) {
      removeGauge(key);
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>();
    for (String key : gaugeValues.keySet()) {
      if (key.startsWith(name + "[") && !activeKeys.contains(key)) {
        missing.add(key);
      }
    }
    markedForDeletion.retainAll(missing);
    for (String key : missing) {
      if (markedForDeletion.add(key)) {
        log.debug("Marked gauge for deletion: {}", key);
      }
    }
  }

  private void removeGauge(String key) {
    gaugeValues.remove(key);
    Gauge gauge = gauges.remove(key);
    if (gauge != null) {
      registry.remove(gauge);
      log.debug("Removed stale gauge: {}", key);
    }
  }

  /**
   * Number of gauges currently registered by this reporter.
   */
  int gaugeCount() {
    return gauges.size();
  }
}
