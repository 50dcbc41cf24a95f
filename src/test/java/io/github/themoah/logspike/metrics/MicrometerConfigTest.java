package io.github.themoah.logspike.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.logspike.ingest.IngestStats;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.datadog.DatadogConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerConfig.
 */
public class MicrometerConfigTest {

  @Test
  void commonTags_alwaysCarryApplication() {
    assertEquals(Tags.of("application", "logspike"), MicrometerConfig.commonTags(null));
    assertEquals(Tags.of("application", "logspike", "env", "prod", "team", "sre"),
      MicrometerConfig.commonTags("env=prod, team=sre"));
  }

  @Test
  void commonTags_ignoreOverrideAndBlankValues() {
    assertEquals(Tags.of("application", "logspike"), MicrometerConfig.commonTags("application=other,region="));
  }

  @Test
  void withCommonTags_tagsEveryMeter() {
    SimpleMeterRegistry registry = MicrometerConfig.withCommonTags(new SimpleMeterRegistry(), "env=prod");
    new MicrometerReporter(registry).reportIngest(new IngestStats(5, 0, Map.of()));

    assertEquals("prod", registry.get("logspike.ingest.succeeded").gauge().getId().getTag("env"));
    assertEquals("logspike", registry.get("logspike.ingest.succeeded").gauge().getId().getTag("application"));
  }

  @Test
  void datadogProperties_defaultSite() {
    DatadogConfig config = MicrometerConfig.datadogProperties("key", null, null)::get;

    assertEquals("key", config.apiKey());
    assertNull(config.applicationKey());
    assertEquals("https://api.datadoghq.com", config.uri());
    assertEquals("host", config.hostTag());
  }

  @Test
  void datadogProperties_customSite() {
    DatadogConfig config = MicrometerConfig.datadogProperties("key", "app", " datadoghq.eu ")::get;

    assertEquals("app", config.applicationKey());
    assertEquals("https://api.datadoghq.eu", config.uri());
  }

  @Test
  void createRegistry_unknownType() {
    assertNull(MicrometerConfig.createRegistry("statsd"));
    assertNull(MicrometerConfig.createRegistry(null));
  }
}
