package io.github.themoah.logspike.store;

import io.github.themoah.logspike.model.Bucket;
import io.github.themoah.logspike.model.LogEvent;
import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.model.RequestSample;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window frequency index keyed by (service, level, template).
 *
 * <p>Each key owns a series of fixed-size time buckets. Adding an event increments (or
 * appends) the bucket its timestamp falls into, then evicts head buckets older than the
 * event timestamp minus the window. Lifetime statistics are never evicted.
 *
 * <p>All mutation and all reads are serialized by one lock per instance, and reads return
 * immutable snapshots. {@link #inLock(Supplier)} lets a caller run a multi-call scan
 * against a single consistent state.
 */
public class PatternStore {

  private static final Logger log = LoggerFactory.getLogger(PatternStore.class);

  private final StoreConfig config;
  private final Map<PatternKey, PatternSeries> series = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private Instant latestTimestamp;

  /**
   * Creates a store.
   *
   * @param config window and bucket sizes, validated at construction of the config
   */
  public PatternStore(StoreConfig config) {
    this.config = config;
    log.info("PatternStore initialized with window={}, bucket={}", config.windowSize(), config.bucketSize());
  }

  /**
   * Records an event.
   *
   * @param event the event; the store takes over accounting for it
   */
  public void add(LogEvent event) {
    PatternKey key = event.key();
    Instant bucketStart = bucketStart(event.timestamp());
    Instant cutoff = event.timestamp().minus(config.windowSize());

    lock.lock();
    try {
      PatternSeries s = series.get(key);
      if (s == null) {
        s = new PatternSeries();
        series.put(key, s);
        log.debug("New pattern key: {}", key);
      }
      s.record(event.timestamp(), bucketStart, event.requestId());
      int evicted = s.evictBefore(cutoff);
      if (evicted > 0) {
        log.trace("Evicted {} buckets for {}", evicted, key);
      }
      if (latestTimestamp == null || event.timestamp().isAfter(latestTimestamp)) {
        latestTimestamp = event.timestamp();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Maps a timestamp to the start of its bucket, in epoch-second arithmetic.
   */
  public Instant bucketStart(Instant timestamp) {
    long seconds = timestamp.getEpochSecond();
    return Instant.ofEpochSecond(seconds - Math.floorMod(seconds, config.bucketSeconds()));
  }

  /**
   * Returns all known keys in first-seen order, including keys whose buckets have all aged out.
   */
  public List<PatternKey> keys() {
    return inLock(() -> new ArrayList<>(series.keySet()));
  }

  /**
   * Returns the live bucket series of a key, oldest first; empty for an unknown key.
   */
  public List<Bucket> buckets(PatternKey key) {
    return inLock(() -> {
      PatternSeries s = series.get(key);
      return s == null ? List.of() : s.buckets();
    });
  }

  /**
   * Returns the lifetime statistics of a key.
   */
  public Optional<PatternStats> stats(PatternKey key) {
    return inLock(() -> {
      PatternSeries s = series.get(key);
      return s == null ? Optional.empty() : Optional.of(s.stats());
    });
  }

  /**
   * Returns the level-weighted count of all buckets of a key starting at or after {@code since}.
   *
   * @return the weighted count, 0 for an unknown key
   */
  public double weightedCount(PatternKey key, Instant since) {
    return inLock(() -> {
      PatternSeries s = series.get(key);
      return s == null ? 0.0 : s.weightedCountSince(since, LevelWeights.weightOf(key.level()));
    });
  }

  /**
   * Returns raw counts per key for buckets starting inside {@code [since, until]}.
   * Keys without activity in the interval are omitted.
   */
  public Map<PatternKey, Long> activityWindow(Instant since, Instant until) {
    return inLock(() -> {
      Map<PatternKey, Long> activity = new LinkedHashMap<>();
      for (Map.Entry<PatternKey, PatternSeries> entry : series.entrySet()) {
        long count = entry.getValue().countBetween(since, until);
        if (count > 0) {
          activity.put(entry.getKey(), count);
        }
      }
      return activity;
    });
  }

  /**
   * Returns the most recent request ids recorded for a key, oldest first.
   */
  public List<RequestSample> requestSamples(PatternKey key) {
    return inLock(() -> {
      PatternSeries s = series.get(key);
      return s == null ? List.of() : s.requestSamples();
    });
  }

  /**
   * Returns the latest event timestamp seen by this store.
   */
  public Optional<Instant> latestTimestamp() {
    return inLock(() -> Optional.ofNullable(latestTimestamp));
  }

  /**
   * Returns the number of known keys.
   */
  public int size() {
    return inLock(series::size);
  }

  public StoreConfig config() {
    return config;
  }

  /**
   * Runs an action while holding the store lock. The lock is reentrant, so the action may
   * call any read method of this store.
   */
  public <T> T inLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
