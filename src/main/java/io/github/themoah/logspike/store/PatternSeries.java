package io.github.themoah.logspike.store;

import io.github.themoah.logspike.model.Bucket;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.model.RequestSample;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bucketed history and lifetime statistics of a single pattern key.
 *
 * <p>Buckets are only appended at the tail and only evicted at the head. Events are
 * expected in non-decreasing time order; a late event whose bucket differs from the
 * tail is appended anyway, so ordering is best-effort. {@code firstSeen} is the time of
 * the first recorded event and never changes afterwards. Not thread-safe: the owning
 * {@link PatternStore} serializes access.
 */
class PatternSeries {

  static final int MAX_REQUEST_SAMPLES = 20;

  private final ArrayDeque<MutableBucket> buckets = new ArrayDeque<>();
  private final ArrayDeque<RequestSample> requestSamples = new ArrayDeque<>();

  private long totalCount;
  private Instant firstSeen;
  private Instant lastSeen;

  /**
   * Counts one event.
   *
   * @param timestamp event time
   * @param bucketStart start of the bucket the event falls into
   * @param requestId request id carried by the event, or null
   */
  void record(Instant timestamp, Instant bucketStart, String requestId) {
    MutableBucket tail = buckets.peekLast();
    if (tail == null || !tail.start.equals(bucketStart)) {
      buckets.addLast(new MutableBucket(bucketStart));
    } else {
      tail.count++;
    }

    totalCount++;
    if (firstSeen == null) {
      firstSeen = timestamp;
    }
    if (lastSeen == null || timestamp.isAfter(lastSeen)) {
      lastSeen = timestamp;
    }

    if (requestId != null && !requestId.isBlank()) {
      if (requestSamples.size() >= MAX_REQUEST_SAMPLES) {
        requestSamples.removeFirst();
      }
      requestSamples.addLast(new RequestSample(requestId, timestamp));
    }
  }

  /**
   * Removes head buckets that start before the cutoff.
   *
   * @return number of buckets removed
   */
  int evictBefore(Instant cutoff) {
    int removed = 0;
    while (!buckets.isEmpty() && buckets.peekFirst().start.isBefore(cutoff)) {
      buckets.removeFirst();
      removed++;
    }
    return removed;
  }

  List<Bucket> buckets() {
    List<Bucket> result = new ArrayList<>(buckets.size());
    for (MutableBucket b : buckets) {
      result.add(new Bucket(b.start, b.count));
    }
    return result;
  }

  /**
   * Sum of bucket counts with start at or after {@code since}, multiplied by {@code weight}.
   */
  double weightedCountSince(Instant since, double weight) {
    double total = 0.0;
    for (MutableBucket b : buckets) {
      if (!b.start.isBefore(since)) {
        total += b.count * weight;
      }
    }
    return total;
  }

  /**
   * Sum of bucket counts with start inside {@code [since, until]}.
   */
  long countBetween(Instant since, Instant until) {
    long total = 0;
    for (MutableBucket b : buckets) {
      if (!b.start.isBefore(since) && !b.start.isAfter(until)) {
        total += b.count;
      }
    }
    return total;
  }

  PatternStats stats() {
    return new PatternStats(totalCount, firstSeen, lastSeen);
  }

  List<RequestSample> requestSamples() {
    return List.copyOf(requestSamples);
  }

  private static final class MutableBucket {
    private final Instant start;
    private long count = 1;

    MutableBucket(Instant start) {
      this.start = start;
    }
  }
}
