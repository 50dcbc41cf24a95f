package io.github.themoah.logspike.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Micrometer registries.
 *
 * <p>Every registry carries {@code application=logspike} plus the tags listed in
 * METRICS_COMMON_TAGS. The {@code service} tag is left to the per-pattern gauges, where it
 * names the service that emitted the logs.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String SERVICE_NAME = "logspike";
  static final String APPLICATION_TAG = "application";
  private static final String DEFAULT_DATADOG_SITE = "datadoghq.com";
  private static final Duration DEFAULT_OTLP_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a Datadog registry from DD_API_KEY, DD_APP_KEY and DD_SITE.
   *
   * @return the registry, or null when DD_API_KEY is missing
   */
  public static MeterRegistry createDatadogRegistry() {
    String apiKey = System.getenv("DD_API_KEY");
    if (apiKey == null || apiKey.isBlank()) {
      log.error("DD_API_KEY is not set, cannot report pattern metrics to Datadog");
      return null;
    }

    Map<String, String> properties = datadogProperties(apiKey, System.getenv("DD_APP_KEY"), System.getenv("DD_SITE"));
    log.info("Creating Datadog meter registry for {}", properties.get("datadog.uri"));
    DatadogConfig config = properties::get;
    return withCommonTags(new DatadogMeterRegistry(config, Clock.SYSTEM), System.getenv("METRICS_COMMON_TAGS"));
  }

  /**
   * Builds the {@code datadog.*} properties backing the Datadog registry config.
   */
  static Map<String, String> datadogProperties(String apiKey, String applicationKey, String site) {
    Map<String, String> properties = new HashMap<>();
    properties.put("datadog.apiKey", apiKey);
    if (applicationKey != null && !applicationKey.isBlank()) {
      properties.put("datadog.applicationKey", applicationKey);
    }
    String host = site == null || site.isBlank() ? DEFAULT_DATADOG_SITE : site.strip();
    properties.put("datadog.uri", "https://api." + host);
    properties.put("datadog.hostTag", "host");
    return properties;
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return withCommonTags(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), System.getenv("METRICS_COMMON_TAGS"));
  }

  /**
   * Creates an OTLP registry (HTTP, cumulative temporality).
   *
   * <p>Reads OTLP_ENDPOINT or OTEL_EXPORTER_OTLP_ENDPOINT, OTLP_STEP_MS, OTLP_HEADERS or
   * OTEL_EXPORTER_OTLP_HEADERS, and OTEL_RESOURCE_ATTRIBUTES.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = System.getenv("OTLP_ENDPOINT");
        if (url != null && !url.isBlank()) {
          return url;
        }
        String base = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
        if (base != null && !base.isBlank()) {
          return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
        }
        return "http://localhost:4318/v1/metrics";
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        String stepMs = System.getenv("OTLP_STEP_MS");
        if (stepMs == null || stepMs.isBlank()) {
          return DEFAULT_OTLP_STEP;
        }
        try {
          return Duration.ofMillis(Long.parseLong(stepMs));
        } catch (NumberFormatException e) {
          log.warn("Invalid OTLP_STEP_MS: {}, using default {}", stepMs, DEFAULT_OTLP_STEP);
          return DEFAULT_OTLP_STEP;
        }
      }

      @Override
      public Map<String, String> headers() {
        String headers = System.getenv("OTLP_HEADERS");
        if (headers == null || headers.isBlank()) {
          headers = System.getenv("OTEL_EXPORTER_OTLP_HEADERS");
        }
        return parseKeyValueList(headers);
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = parseKeyValueList(System.getenv("OTEL_RESOURCE_ATTRIBUTES"));
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        if (serviceName != null && !serviceName.isBlank()) {
          attributes.put("service.name", serviceName);
        }
        attributes.putIfAbsent("service.name", SERVICE_NAME);
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return withCommonTags(registry, System.getenv("METRICS_COMMON_TAGS"));
  }

  /**
   * Applies {@link #commonTags(String)} to a freshly created registry, before any meter exists.
   */
  static <R extends MeterRegistry> R withCommonTags(R registry, String extraTags) {
    Tags tags = commonTags(extraTags);
    registry.config().commonTags(tags);
    log.info("Common metric tags: {}", tags);
    return registry;
  }

  /**
   * Returns {@code application=logspike} merged with a {@code key=value,...} list.
   * The application tag cannot be overridden and entries with blank values are dropped.
   */
  static Tags commonTags(String extraTags) {
    Tags tags = Tags.of(APPLICATION_TAG, SERVICE_NAME);
    for (Map.Entry<String, String> entry : parseKeyValueList(extraTags).entrySet()) {
      if (APPLICATION_TAG.equals(entry.getKey()) || entry.getValue().isEmpty()) {
        continue;
      }
      tags = tags.and(entry.getKey(), entry.getValue());
    }
    return tags;
  }

  /**
   * Parses {@code key1=value1,key2=value2}; malformed entries are skipped with a warning.
   */
  static Map<String, String> parseKeyValueList(String value) {
    Map<String, String> result = new HashMap<>();
    if (value == null || value.isBlank()) {
      return result;
    }
    for (String entry : value.split(",")) {
      String[] parts = entry.trim().split("=", 2);
      if (parts.length == 2) {
        result.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid entry (expected key=value): {}", entry);
      }
    }
    return result;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus", "datadog" or "otlp"
   * @return the registry, or null if the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.strip().toLowerCase()) {
      case "datadog" -> createDatadogRegistry();
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
