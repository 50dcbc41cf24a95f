package io.github.themoah.logspike.config;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param detectionIntervalMs period of the detection timer in milliseconds
 * @param detectionClock where detection takes "now" from
 * @param contextWindow span of the context gathered around an anomaly
 */
public record AppConfig(
  int httpPort,
  long detectionIntervalMs,
  DetectionClock detectionClock,
  Duration contextWindow
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_DETECTION_INTERVAL_MS = 60_000L;
  private static final long DEFAULT_CONTEXT_WINDOW_MS = 300_000L;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = getEnvLong("DETECTION_INTERVAL_MS", DEFAULT_DETECTION_INTERVAL_MS);
    long contextMs = getEnvLong("CONTEXT_WINDOW_MS", DEFAULT_CONTEXT_WINDOW_MS);

    String clockValue = System.getenv("DETECTION_CLOCK");
    DetectionClock clock = DetectionClock.EVENT;
    if (clockValue != null && !clockValue.isBlank()) {
      DetectionClock parsed = DetectionClock.fromValue(clockValue);
      if (parsed == null) {
        log.warn("Invalid DETECTION_CLOCK: {}, using default: {}", clockValue, clock.getValue());
      } else {
        clock = parsed;
      }
    }

    log.info("AppConfig loaded: httpPort={}, detectionIntervalMs={}, detectionClock={}, contextWindowMs={}",
      port, interval, clock.getValue(), contextMs);
    return new AppConfig(port, interval, clock, Duration.ofMillis(contextMs));
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
