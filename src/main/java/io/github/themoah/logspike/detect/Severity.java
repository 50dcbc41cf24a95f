package io.github.themoah.logspike.detect;

/**
 * Ordinal severity bands for anomaly scores.
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Maps a score to its band.
   *
   * @param score the anomaly severity score
   * @param thresholds lower bounds of the MEDIUM, HIGH and CRITICAL bands
   * @return the band the score falls into
   */
  public static Severity of(double score, SeverityThresholds thresholds) {
    if (score >= thresholds.critical()) {
      return CRITICAL;
    }
    if (score >= thresholds.high()) {
      return HIGH;
    }
    if (score >= thresholds.medium()) {
      return MEDIUM;
    }
    return LOW;
  }

  /**
   * Returns a lowercase representation suitable for metric labels.
   */
  public String toMetricValue() {
    return name().toLowerCase();
  }
}
