package io.github.themoah.logspike.detect;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for anomaly detection.
 *
 * @param recentWindow span before "now" whose activity is compared against the baseline (default 1 minute)
 * @param spikeMultiplier how many times the baseline the recent count must reach to be a spike (default 5.0)
 * @param minBaseline minimum baseline average before spike detection applies (default 5.0)
 * @param trackNearMiss whether to report keys that came close to the spike threshold (default true)
 * @param nearMissRatio fraction of the threshold from which a key counts as a near-miss (default 0.7)
 */
public record DetectorConfig(
  Duration recentWindow,
  double spikeMultiplier,
  double minBaseline,
  boolean trackNearMiss,
  double nearMissRatio
) {

  private static final Logger log = LoggerFactory.getLogger(DetectorConfig.class);

  private static final long DEFAULT_RECENT_WINDOW_MS = 60_000L;
  private static final double DEFAULT_SPIKE_MULTIPLIER = 5.0;
  private static final double DEFAULT_MIN_BASELINE = 5.0;
  private static final boolean DEFAULT_TRACK_NEAR_MISS = true;
  private static final double DEFAULT_NEAR_MISS_RATIO = 0.7;

  public DetectorConfig {
    if (recentWindow == null || recentWindow.isNegative() || recentWindow.isZero()) {
      throw new IllegalArgumentException("recentWindow must be positive, got " + recentWindow);
    }
    if (spikeMultiplier <= 0) {
      throw new IllegalArgumentException("spikeMultiplier must be positive, got " + spikeMultiplier);
    }
  }

  public DetectorConfig(Duration recentWindow, double spikeMultiplier, double minBaseline, boolean trackNearMiss) {
    this(recentWindow, spikeMultiplier, minBaseline, trackNearMiss, DEFAULT_NEAR_MISS_RATIO);
  }

  /**
   * Returns the default configuration with the given recent window.
   */
  public static DetectorConfig defaults(Duration recentWindow) {
    return new DetectorConfig(recentWindow, DEFAULT_SPIKE_MULTIPLIER, DEFAULT_MIN_BASELINE,
      DEFAULT_TRACK_NEAR_MISS, DEFAULT_NEAR_MISS_RATIO);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DETECTOR_RECENT_WINDOW_MS - Recent window in milliseconds (default: 60000)</li>
   *   <li>DETECTOR_SPIKE_MULTIPLIER - Spike threshold as a multiple of the baseline (default: 5.0)</li>
   *   <li>DETECTOR_MIN_BASELINE - Baseline floor for spike detection (default: 5.0)</li>
   *   <li>DETECTOR_TRACK_NEAR_MISS - Report near-misses (default: true)</li>
   *   <li>DETECTOR_NEAR_MISS_RATIO - Near-miss fraction of the threshold (default: 0.7)</li>
   * </ul>
   */
  public static DetectorConfig fromEnvironment() {
    long recentMs = parseLong("DETECTOR_RECENT_WINDOW_MS", DEFAULT_RECENT_WINDOW_MS);
    double multiplier = parseDouble("DETECTOR_SPIKE_MULTIPLIER", DEFAULT_SPIKE_MULTIPLIER);
    double minBaseline = parseDouble("DETECTOR_MIN_BASELINE", DEFAULT_MIN_BASELINE);
    boolean trackNearMiss = parseBoolean("DETECTOR_TRACK_NEAR_MISS", DEFAULT_TRACK_NEAR_MISS);
    double nearMissRatio = parseDouble("DETECTOR_NEAR_MISS_RATIO", DEFAULT_NEAR_MISS_RATIO);

    DetectorConfig config = new DetectorConfig(
      Duration.ofMillis(recentMs), multiplier, minBaseline, trackNearMiss, nearMissRatio);
    log.info("Detector config: recentWindowMs={}, spikeMultiplier={}, minBaseline={}, trackNearMiss={}, nearMissRatio={}",
      recentMs, multiplier, minBaseline, trackNearMiss, nearMissRatio);

    return config;
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
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

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
