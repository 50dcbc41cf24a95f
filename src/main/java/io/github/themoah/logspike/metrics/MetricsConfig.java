package io.github.themoah.logspike.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics configuration loaded from environment variables.
 *
 * @param enabled whether metrics are reported at all
 * @param reporterType registry backend: prometheus, datadog or otlp
 * @param jvmMetricsEnabled whether JVM binders are attached
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Loads METRICS_ENABLED (default true), METRICS_REPORTER (default prometheus) and
   * METRICS_JVM_ENABLED (default false).
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = getEnvBoolean("METRICS_ENABLED", true);
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = getEnvBoolean("METRICS_JVM_ENABLED", false);

    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.strip());
  }
}
