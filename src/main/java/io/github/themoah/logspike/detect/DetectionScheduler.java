package io.github.themoah.logspike.detect;

import io.github.themoah.logspike.config.DetectionClock;
import io.github.themoah.logspike.ingest.Ingestor;
import io.github.themoah.logspike.metrics.MetricsReporter;
import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.store.PatternStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically runs anomaly detection and publishes the latest result.
 */
public class DetectionScheduler {

  private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

  private final Vertx vertx;
  private final AnomalyDetector detector;
  private final PatternStore store;
  private final Ingestor ingestor;
  private final MetricsReporter reporter;
  private final SeverityThresholds thresholds;
  private final DetectionClock detectionClock;
  private final Clock wallClock;
  private final long intervalMs;
  private final AtomicReference<DetectionResult> latest = new AtomicReference<>();

  private Long timerId;

  /**
   * Creates a scheduler.
   *
   * @param reporter metrics reporter, or null when metrics are disabled
   */
  public DetectionScheduler(
    Vertx vertx,
    AnomalyDetector detector,
    PatternStore store,
    Ingestor ingestor,
    MetricsReporter reporter,
    SeverityThresholds thresholds,
    DetectionClock detectionClock,
    Clock wallClock,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.detector = detector;
    this.store = store;
    this.ingestor = ingestor;
    this.reporter = reporter;
    this.thresholds = thresholds;
    this.detectionClock = detectionClock;
    this.wallClock = wallClock;
    this.intervalMs = intervalMs;
  }

  /**
   * Starts the reporter, runs one pass, then schedules the periodic timer.
   */
  public Future<Void> start() {
    log.info("Starting detection scheduler with interval: {}ms, clock: {}",
      intervalMs, detectionClock.getValue());

    Future<Void> reporterStarted = reporter != null ? reporter.start() : Future.succeededFuture();
    return reporterStarted
      .onComplete(ar -> {
        runDetection();
        timerId = vertx.setPeriodic(intervalMs, id -> runDetection());
        log.info("Detection scheduler started, timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping detection scheduler");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return reporter != null ? reporter.close() : Future.succeededFuture();
  }

  /**
   * Runs one detection pass against the configured clock.
   */
  public DetectionResult runDetection() {
    Instant now = resolveNow();
    DetectionResult result;
    try {
      result = detector.detect(now);
    } catch (RuntimeException e) {
      log.error("Detection pass failed at {}", now, e);
      return latest.get();
    }
    latest.set(result);

    for (Anomaly anomaly : result.anomalies()) {
      Severity severity = Severity.of(anomaly.severity(), thresholds);
      if (severity == Severity.CRITICAL || severity == Severity.HIGH) {
        log.warn("[{}] {} {} score={} key={}", severity, anomaly.reason().getValue(),
          anomaly.key().service(), String.format("%.2f", anomaly.severity()), anomaly.key());
      } else {
        log.info("[{}] {} {} score={} key={}", severity, anomaly.reason().getValue(),
          anomaly.key().service(), String.format("%.2f", anomaly.severity()), anomaly.key());
      }
    }

    if (reporter != null) {
      reporter.reportIngest(ingestor.stats());
      reporter.reportDetection(result, thresholds, store.size());
    }
    return result;
  }

  /**
   * Returns the instant detection evaluates against. With the event clock this is the
   * latest event timestamp, or the wall clock while the store is empty.
   */
  Instant resolveNow() {
    if (detectionClock == DetectionClock.EVENT) {
      return store.latestTimestamp().orElseGet(wallClock::instant);
    }
    return wallClock.instant();
  }

  /**
   * Returns the result of the most recent pass, or null before the first pass.
   */
  public DetectionResult latest() {
    return latest.get();
  }

  public SeverityThresholds thresholds() {
    return thresholds;
  }
}
