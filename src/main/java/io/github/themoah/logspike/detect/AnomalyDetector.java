package io.github.themoah.logspike.detect;

import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.Anomaly.Reason;
import io.github.themoah.logspike.model.Bucket;
import io.github.themoah.logspike.model.DetectionResult;
import io.github.themoah.logspike.model.NearMiss;
import io.github.themoah.logspike.model.PatternKey;
import io.github.themoah.logspike.model.PatternStats;
import io.github.themoah.logspike.store.PatternStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags pattern keys whose recent activity departs from their own history.
 *
 * <p>For every key the detector compares the level-weighted count of the recent window
 * with the average raw count per bucket before it:
 * <ul>
 *   <li>no history and recent activity: {@code new_pattern}, severity = recent count</li>
 *   <li>baseline at least {@code minBaseline} and recent count at least
 *       {@code baseline * spikeMultiplier}: {@code spike}, severity = recent / baseline</li>
 *   <li>recent count at least {@code nearMissRatio} of that threshold: near-miss</li>
 * </ul>
 *
 * <p>The baseline uses raw counts while the recent signal is weighted by level.
 * Detection only reads the store and runs the whole scan under the store lock.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  private final PatternStore store;
  private final DetectorConfig config;

  public AnomalyDetector(PatternStore store, DetectorConfig config) {
    this.store = store;
    this.config = config;
  }

  /**
   * Scans every key in the store.
   *
   * @param now the instant the recent window ends at
   * @return anomalies sorted by descending severity, and near-misses
   */
  public DetectionResult detect(Instant now) {
    DetectionResult result = store.inLock(() -> scan(now));

    if (!result.anomalies().isEmpty()) {
      log.info("Detected {} anomalies and {} near-misses at {}",
        result.anomalies().size(), result.nearMisses().size(), now);
    } else {
      log.debug("No anomalies at {} ({} near-misses)", now, result.nearMisses().size());
    }
    return result;
  }

  private DetectionResult scan(Instant now) {
    List<Anomaly> anomalies = new ArrayList<>();
    List<NearMiss> nearMisses = new ArrayList<>();

    Instant recentCutoff = now.minus(config.recentWindow());

    for (PatternKey key : store.keys()) {
      List<Bucket> buckets = store.buckets(key);
      if (buckets.isEmpty()) {
        continue;
      }

      double recent = store.weightedCount(key, recentCutoff);
      double baselineAvg = baselineAverage(buckets, recentCutoff);
      Optional<PatternStats> stats = store.stats(key);
      Instant firstSeen = stats.map(PatternStats::firstSeen).orElse(null);
      Instant lastSeen = stats.map(PatternStats::lastSeen).orElse(null);

      if (baselineAvg == 0.0 && recent > 0) {
        anomalies.add(new Anomaly(key, Reason.NEW_PATTERN, recent, recent, 0.0, firstSeen, lastSeen));
        log.debug("New pattern: key={}, recent={}", key, recent);
        continue;
      }

      if (baselineAvg < config.minBaseline()) {
        continue;
      }

      double threshold = baselineAvg * config.spikeMultiplier();
      if (recent >= threshold) {
        double severity = recent / baselineAvg;
        anomalies.add(new Anomaly(key, Reason.SPIKE, severity, recent, baselineAvg, firstSeen, lastSeen));
        log.debug("Spike: key={}, recent={}, baseline={}, severity={}",
          key, recent, String.format("%.2f", baselineAvg), String.format("%.2f", severity));
      } else if (config.trackNearMiss() && recent >= threshold * config.nearMissRatio()) {
        nearMisses.add(new NearMiss(key, recent, baselineAvg, threshold));
      }
    }

    // List.sort is stable, so ties keep key order
    anomalies.sort(Comparator.comparingDouble(Anomaly::severity).reversed());
    return new DetectionResult(now, anomalies, nearMisses);
  }

  /**
   * Average raw count of the buckets that start strictly before the cutoff, 0 if there are none.
   */
  static double baselineAverage(List<Bucket> buckets, Instant recentCutoff) {
    long total = 0;
    int count = 0;
    for (Bucket bucket : buckets) {
      if (bucket.start().isBefore(recentCutoff)) {
        total += bucket.count();
        count++;
      }
    }
    return count == 0 ? 0.0 : (double) total / count;
  }

  public DetectorConfig config() {
    return config;
  }
}
