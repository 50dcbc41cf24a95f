package io.github.themoah.logspike.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.logspike.model.Bucket;
import io.github.themoah.logspike.model.LogEvent;
import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.model.RequestSample;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PatternStore and StoreConfig.
 */
public class PatternStoreTest {

  private static final Instant T0 = Instant.parse("2026-01-03T14:00:00Z");
  private static final PatternKey TIMEOUT = new PatternKey("api", "ERROR", "timeout after <DURATION>ms");

  private final PatternStore store = new PatternStore(
    new StoreConfig(Duration.ofMinutes(10), Duration.ofMinutes(1)));

  private static LogEvent event(PatternKey key, Instant ts) {
    return LogEvent.of(ts, key.service(), key.level(), key.template(), "raw");
  }

  @Test
  void bucketStart_alignsToBucketBoundary() {
    assertEquals(T0, store.bucketStart(T0.plusSeconds(59)));
    assertEquals(T0.plusSeconds(60), store.bucketStart(T0.plusSeconds(60)));
    assertEquals(T0, store.bucketStart(T0.plusMillis(999)));
  }

  @Test
  void add_countsIntoBuckets() {
    store.add(event(TIMEOUT, T0.plusSeconds(5)));
    store.add(event(TIMEOUT, T0.plusSeconds(10)));
    store.add(event(TIMEOUT, T0.plusSeconds(70)));

    List<Bucket> buckets = store.buckets(TIMEOUT);
    assertEquals(List.of(new Bucket(T0, 2), new Bucket(T0.plusSeconds(60), 1)), buckets);
  }

  @Test
  void weightedCount_appliesLevelWeight() {
    for (int i = 0; i < 3; i++) {
      store.add(event(TIMEOUT, T0.plusSeconds(i)));
    }

    assertEquals(15.0, store.weightedCount(TIMEOUT, T0));
    assertEquals(0.0, store.weightedCount(TIMEOUT, T0.plusSeconds(60)));
    assertEquals(0.0, store.weightedCount(new PatternKey("x", "INFO", "y"), T0));
  }

  @Test
  void add_bucketAtExactWindowEdgeIsRetained() {
    store.add(event(TIMEOUT, T0));
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(10))));

    assertEquals(2, store.buckets(TIMEOUT).size());

    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(10)).plusSeconds(1)));

    List<Bucket> buckets = store.buckets(TIMEOUT);
    assertEquals(1, buckets.size());
    assertEquals(new Bucket(T0.plus(Duration.ofMinutes(10)), 2), buckets.get(0));
  }

  @Test
  void stats_surviveEviction() {
    store.add(event(TIMEOUT, T0));
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(30))));

    PatternStats stats = store.stats(TIMEOUT).orElseThrow();
    assertEquals(2, stats.totalCount());
    assertEquals(T0, stats.firstSeen());
    assertEquals(T0.plus(Duration.ofMinutes(30)), stats.lastSeen());
    assertEquals(1, store.buckets(TIMEOUT).size());
  }

  @Test
  void add_lateEventAppendsNewBucket() {
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(5))));
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(3))));

    List<Bucket> buckets = store.buckets(TIMEOUT);
    assertEquals(2, buckets.size());
    assertEquals(T0.plus(Duration.ofMinutes(3)), buckets.get(1).start());
    PatternStats stats = store.stats(TIMEOUT).orElseThrow();
    assertEquals(T0.plus(Duration.ofMinutes(5)), stats.firstSeen());
    assertEquals(T0.plus(Duration.ofMinutes(5)), stats.lastSeen());
    assertEquals(2, stats.totalCount());
    assertEquals(T0.plus(Duration.ofMinutes(5)), store.latestTimestamp().orElseThrow());
  }

  @Test
  void keys_keepFirstSeenOrder() {
    PatternKey second = new PatternKey("api", "INFO", "ok");
    store.add(event(TIMEOUT, T0));
    store.add(event(second, T0));
    store.add(event(TIMEOUT, T0.plusSeconds(1)));

    assertEquals(List.of(TIMEOUT, second), store.keys());
    assertEquals(2, store.size());
  }

  @Test
  void activityWindow_omitsInactiveKeys() {
    PatternKey quiet = new PatternKey("api", "INFO", "ok");
    store.add(event(quiet, T0));
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(3))));
    store.add(event(TIMEOUT, T0.plus(Duration.ofMinutes(4))));

    Map<PatternKey, Long> activity = store.activityWindow(
      T0.plus(Duration.ofMinutes(2)), T0.plus(Duration.ofMinutes(4)));

    assertEquals(Map.of(TIMEOUT, 2L), activity);
  }

  @Test
  void requestSamples_areBounded() {
    for (int i = 0; i < 25; i++) {
      store.add(new LogEvent(T0.plusSeconds(i), "api", "ERROR", "boom", "raw", "req-" + i));
    }

    List<RequestSample> samples = store.requestSamples(new PatternKey("api", "ERROR", "boom"));
    assertEquals(20, samples.size());
    assertEquals("req-5", samples.get(0).requestId());
    assertEquals("req-24", samples.get(19).requestId());
  }

  @Test
  void bucketing_independentOfCrossKeyInterleaving() {
    List<PatternKey> keys = List.of(
      TIMEOUT, new PatternKey("api", "WARN", "slow"), new PatternKey("db", "ERROR", "deadlock"));
    // One non-decreasing stream per key, spanning head eviction of the 10 minute window.
    List<List<LogEvent>> streams = new ArrayList<>();
    for (int k = 0; k < keys.size(); k++) {
      List<LogEvent> stream = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        stream.add(event(keys.get(k), T0.plusSeconds(i * (23L + 11L * k))));
      }
      streams.add(stream);
    }

    PatternStore roundRobin = new PatternStore(new StoreConfig(Duration.ofMinutes(10), Duration.ofMinutes(1)));
    for (int i = 0; i < 40; i++) {
      for (List<LogEvent> stream : streams) {
        roundRobin.add(stream.get(i));
      }
    }
    PatternStore keyByKey = new PatternStore(new StoreConfig(Duration.ofMinutes(10), Duration.ofMinutes(1)));
    for (int k = streams.size() - 1; k >= 0; k--) {
      streams.get(k).forEach(keyByKey::add);
    }

    assertEquals(Set.copyOf(roundRobin.keys()), Set.copyOf(keyByKey.keys()));
    for (PatternKey key : keys) {
      assertEquals(roundRobin.buckets(key), keyByKey.buckets(key), "buckets of " + key);
      assertEquals(roundRobin.stats(key), keyByKey.stats(key), "stats of " + key);
    }
    assertTrue(roundRobin.buckets(keys.get(2)).size() < 40, "window should have evicted old buckets");
  }

  @Test
  void latestTimestamp_emptyStore() {
    assertTrue(store.latestTimestamp().isEmpty());
    assertTrue(store.buckets(TIMEOUT).isEmpty());
    assertTrue(store.stats(TIMEOUT).isEmpty());
  }

  @Test
  void config_rejectsInvalidSizes() {
    assertThrows(IllegalArgumentException.class,
      () -> new StoreConfig(Duration.ofMinutes(10), Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
      () -> new StoreConfig(Duration.ofMinutes(10), Duration.ofSeconds(-1)));
    assertThrows(IllegalArgumentException.class,
      () -> new StoreConfig(Duration.ofSeconds(30), Duration.ofMinutes(1)));
    assertThrows(IllegalArgumentException.class,
      () -> new StoreConfig(Duration.ofMinutes(10), Duration.ofMillis(1500)));
  }

  @Test
  void config_acceptsNonMultipleWindow() {
    StoreConfig config = new StoreConfig(Duration.ofSeconds(150), Duration.ofMinutes(1));
    assertEquals(60, config.bucketSeconds());
  }

  @Test
  void levelWeights() {
    assertEquals(5.0, LevelWeights.weightOf("ERROR"));
    assertEquals(2.0, LevelWeights.weightOf("WARN"));
    assertEquals(1.0, LevelWeights.weightOf("INFO"));
    assertEquals(0.5, LevelWeights.weightOf("DEBUG"));
    assertEquals(1.0, LevelWeights.weightOf("FATAL"));
    assertEquals(1.0, LevelWeights.weightOf(null));
  }
}
