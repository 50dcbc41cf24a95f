package io.github.themoah.logspike.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.logspike.config.DetectionClock;
import io.github.themoah.logspike.ingest.Ingestor;
import io.github.themoah.logspike.metrics.MicrometerReporter;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.normalize.Normalizer;
import io.github.themoah.logspike.source.IngestPipeline;
import io.github.themoah.logspike.store.PatternStore;
import io.github.themoah.logspike.store.StoreConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for DetectionScheduler.
 */
@ExtendWith(VertxExtension.class)
public class DetectionSchedulerTest {

  private static final Instant WALL = Instant.parse("2026-01-03T18:00:00Z");

  private PatternStore store;
  private Ingestor ingestor;
  private IngestPipeline pipeline;
  private SimpleMeterRegistry registry;

  @BeforeEach
  void setUp() {
    store = new PatternStore(new StoreConfig(Duration.ofMinutes(10), Duration.ofMinutes(1)));
    ingestor = new Ingestor(new Normalizer());
    pipeline = new IngestPipeline(ingestor, store);
    registry = new SimpleMeterRegistry();
  }

  private DetectionScheduler scheduler(Vertx vertx, DetectionClock clock) {
    AnomalyDetector detector = new AnomalyDetector(store, new DetectorConfig(Duration.ofMinutes(1), 5.0, 1.0, true));
    return new DetectionScheduler(vertx, detector, store, ingestor, new MicrometerReporter(registry),
      SeverityThresholds.DEFAULT, clock, Clock.fixed(WALL, ZoneOffset.UTC), 60_000L);
  }

  @Test
  void resolveNow_eventClockUsesLatestTimestamp(Vertx vertx) {
    DetectionScheduler scheduler = scheduler(vertx, DetectionClock.EVENT);

    assertEquals(WALL, scheduler.resolveNow());

    pipeline.accept("2026-01-03T14:05:10 ERROR api boom");
    assertEquals(Instant.parse("2026-01-03T14:05:10Z"), scheduler.resolveNow());
  }

  @Test
  void resolveNow_wallClock(Vertx vertx) {
    DetectionScheduler scheduler = scheduler(vertx, DetectionClock.WALL);
    pipeline.accept("2026-01-03T14:05:10 ERROR api boom");

    assertEquals(WALL, scheduler.resolveNow());
  }

  @Test
  void runDetection_publishesLatestResultAndMetrics(Vertx vertx) {
    DetectionScheduler scheduler = scheduler(vertx, DetectionClock.EVENT);
    assertNull(scheduler.latest());

    pipeline.accept("2026-01-03T14:05:10 ERROR api boom");
    pipeline.accept("2026-01-03T14:05:11 ERROR api boom");
    pipeline.accept("garbage");

    DetectionResult result = scheduler.runDetection();

    assertNotNull(result);
    assertEquals(result, scheduler.latest());
    assertEquals(1, result.anomalies().size());
    assertEquals(2.0, registry.get("logspike.ingest.succeeded").gauge().value());
    assertEquals(1.0, registry.get("logspike.store.keys").gauge().value());
    assertEquals(1.0, registry.get("logspike.anomalies").tag("severity", "high").gauge().value());
  }

  @Test
  void start_runsFirstPassImmediately(Vertx vertx, VertxTestContext testContext) {
    DetectionScheduler scheduler = scheduler(vertx, DetectionClock.EVENT);
    pipeline.accept("2026-01-03T14:05:10 WARN api slow");

    scheduler.start()
      .compose(v -> {
        testContext.verify(() -> {
          assertNotNull(scheduler.latest());
          assertEquals(1, scheduler.latest().anomalies().size());
        });
        return scheduler.stop();
      })
      .onComplete(testContext.succeedingThenComplete());
  }
}
