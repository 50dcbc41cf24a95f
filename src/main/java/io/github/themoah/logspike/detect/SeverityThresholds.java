package io.github.themoah.logspike.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lower bounds of the severity bands.
 *
 * @param critical score at or above which an anomaly is CRITICAL (default 20)
 * @param high score at or above which an anomaly is HIGH (default 10)
 * @param medium score at or above which an anomaly is MEDIUM (default 5)
 */
public record SeverityThresholds(
  double critical,
  double high,
  double medium
) {

  private static final Logger log = LoggerFactory.getLogger(SeverityThresholds.class);

  public static final SeverityThresholds DEFAULT = new SeverityThresholds(20.0, 10.0, 5.0);

  public SeverityThresholds {
    if (!(critical >= high && high >= medium)) {
      throw new IllegalArgumentException(
        "Severity thresholds must satisfy critical >= high >= medium, got "
          + critical + ", " + high + ", " + medium);
    }
  }

  /**
   * Loads thresholds from SEVERITY_CRITICAL, SEVERITY_HIGH and SEVERITY_MEDIUM.
   */
  public static SeverityThresholds fromEnvironment() {
    double critical = parseDouble("SEVERITY_CRITICAL", DEFAULT.critical());
    double high = parseDouble("SEVERITY_HIGH", DEFAULT.high());
    double medium = parseDouble("SEVERITY_MEDIUM", DEFAULT.medium());
    log.info("Severity thresholds: critical={}, high={}, medium={}", critical, high, medium);
    return new SeverityThresholds(critical, high, medium);
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
