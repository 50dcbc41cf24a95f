package io.github.themoah.logspike.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.logspike.detect.SeverityThresholds;
import io.github.themoah.logspike.ingest.IngestStats;
import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.Anomaly.Reason;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.model.NearMiss;
import io.github.themoah.logspike.model.PatternKey;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerReporter.
 */
public class MicrometerReporterTest {

  private static final Instant NOW = Instant.parse("2026-01-03T14:05:30Z");
  private static final PatternKey TIMEOUT = new PatternKey("user-service", "ERROR", "timeout after <DURATION>ms");
  private static final PatternKey LOGIN = new PatternKey("auth", "INFO", "login ok");

  private SimpleMeterRegistry registry;
  private MicrometerReporter reporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    reporter = new MicrometerReporter(registry);
  }

  private static Anomaly anomaly(PatternKey key, Reason reason, double severity) {
    return new Anomaly(key, reason, severity, severity, 1.0, NOW.minusSeconds(300), NOW);
  }

  private static DetectionResult result(Anomaly... anomalies) {
    return new DetectionResult(NOW, List.of(anomalies), List.of());
  }

  private Gauge severityGauge(PatternKey key) {
    return registry.find("logspike.anomaly.severity")
      .tag("service", key.service())
      .tag("template", key.template())
      .gauge();
  }

  @Test
  void reportIngest_countsPerReason() {
    reporter.reportIngest(new IngestStats(10, 3, Map.of("unparseable_line", 2L, "unrecognized_format", 1L)));

    assertEquals(10.0, registry.get("logspike.ingest.succeeded").gauge().value());
    assertEquals(3.0, registry.get("logspike.ingest.failed").tag("reason", "all").gauge().value());
    assertEquals(2.0, registry.get("logspike.ingest.failed").tag("reason", "unparseable_line").gauge().value());
  }

  @Test
  void reportDetection_severityGaugesAndBands() {
    reporter.reportDetection(new DetectionResult(NOW,
      List.of(anomaly(TIMEOUT, Reason.SPIKE, 125.0), anomaly(LOGIN, Reason.NEW_PATTERN, 3.0)),
      List.of(new NearMiss(new PatternKey("billing", "WARN", "retry"), 8.0, 2.0, 10.0))),
      SeverityThresholds.DEFAULT, 7);

    assertEquals(125.0, severityGauge(TIMEOUT).value());
    assertEquals(3.0, severityGauge(LOGIN).value());
    assertEquals("spike", severityGauge(TIMEOUT).getId().getTag("reason"));
    assertEquals(1.0, registry.get("logspike.anomalies").tag("severity", "critical").gauge().value());
    assertEquals(1.0, registry.get("logspike.anomalies").tag("severity", "low").gauge().value());
    assertEquals(0.0, registry.get("logspike.anomalies").tag("severity", "high").gauge().value());
    assertEquals(1.0, registry.get("logspike.near_misses").gauge().value());
    assertEquals(7.0, registry.get("logspike.store.keys").gauge().value());
  }

  @Test
  void reportDetection_updatesExistingGauge() {
    reporter.reportDetection(result(anomaly(TIMEOUT, Reason.SPIKE, 12.0)), SeverityThresholds.DEFAULT, 1);
    int gauges = reporter.gaugeCount();

    reporter.reportDetection(result(anomaly(TIMEOUT, Reason.SPIKE, 30.0)), SeverityThresholds.DEFAULT, 1);

    assertEquals(30.0, severityGauge(TIMEOUT).value());
    assertEquals(gauges, reporter.gaugeCount());
  }

  @Test
  void staleSeverityGauge_removedAfterSecondMissingPass() {
    reporter.reportDetection(result(anomaly(TIMEOUT, Reason.SPIKE, 12.0)), SeverityThresholds.DEFAULT, 1);
    assertNotNull(severityGauge(TIMEOUT));

    reporter.reportDetection(result(), SeverityThresholds.DEFAULT, 1);
    assertNotNull(severityGauge(TIMEOUT), "first missing pass only marks the gauge");

    reporter.reportDetection(result(), SeverityThresholds.DEFAULT, 1);
    assertNull(severityGauge(TIMEOUT));
  }

  @Test
  void staleSeverityGauge_keptWhenAnomalyReturns() {
    reporter.reportDetection(result(anomaly(TIMEOUT, Reason.SPIKE, 12.0)), SeverityThresholds.DEFAULT, 1);
    reporter.reportDetection(result(), SeverityThresholds.DEFAULT, 1);
    reporter.reportDetection(result(anomaly(TIMEOUT, Reason.SPIKE, 14.0)), SeverityThresholds.DEFAULT, 1);
    reporter.reportDetection(result(), SeverityThresholds.DEFAULT, 1);

    assertNotNull(severityGauge(TIMEOUT));
    assertEquals(14.0, severityGauge(TIMEOUT).value());
  }

  @Test
  void parseKeyValueList() {
    assertEquals(Map.of("env", "prod", "team", "sre"), MicrometerConfig.parseKeyValueList("env=prod, team=sre,broken"));
    assertEquals(Map.of(), MicrometerConfig.parseKeyValueList(null));
  }
}
