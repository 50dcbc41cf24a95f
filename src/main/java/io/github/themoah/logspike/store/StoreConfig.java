package io.github.themoah.logspike.store;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retention and granularity of a {@link PatternStore}.
 *
 * @param windowSize retention horizon; older buckets are evicted
 * @param bucketSize aggregation granularity, a whole number of seconds
 */
public record StoreConfig(
  Duration windowSize,
  Duration bucketSize
) {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  private static final long DEFAULT_WINDOW_MS = 600_000L;
  private static final long DEFAULT_BUCKET_MS = 60_000L;

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if the bucket is not a positive whole number of
   *     seconds, or the window is shorter than one bucket
   */
  public StoreConfig {
    if (windowSize == null || bucketSize == null) {
      throw new IllegalArgumentException("windowSize and bucketSize are required");
    }
    if (bucketSize.isNegative() || bucketSize.isZero()) {
      throw new IllegalArgumentException("bucketSize must be positive, got " + bucketSize);
    }
    if (bucketSize.getNano() != 0) {
      throw new IllegalArgumentException("bucketSize must be a whole number of seconds, got " + bucketSize);
    }
    if (windowSize.compareTo(bucketSize) < 0) {
      throw new IllegalArgumentException(
        "windowSize " + windowSize + " must not be smaller than bucketSize " + bucketSize);
    }
    if (windowSize.toMillis() % bucketSize.toMillis() != 0) {
      log.warn("windowSize {} is not a multiple of bucketSize {}; the oldest bucket will be partially covered",
        windowSize, bucketSize);
    }
  }

  public long bucketSeconds() {
    return bucketSize.getSeconds();
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>STORE_WINDOW_MS - Retention horizon in milliseconds (default: 600000)</li>
   *   <li>STORE_BUCKET_MS - Bucket size in milliseconds (default: 60000)</li>
   * </ul>
   *
   * @throws IllegalArgumentException if the resulting configuration is invalid
   */
  public static StoreConfig fromEnvironment() {
    long windowMs = parseLong("STORE_WINDOW_MS", DEFAULT_WINDOW_MS);
    long bucketMs = parseLong("STORE_BUCKET_MS", DEFAULT_BUCKET_MS);

    StoreConfig config = new StoreConfig(Duration.ofMillis(windowMs), Duration.ofMillis(bucketMs));
    log.info("Store config: windowMs={}, bucketMs={}", windowMs, bucketMs);
    return config;
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
