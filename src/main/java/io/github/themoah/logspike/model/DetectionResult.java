package io.github.themoah.logspike.model;

import java.time.Instant;
import java.util.List;

/**
 * Output of one detection pass.
 *
 * @param detectedAt the "now" the pass was evaluated against
 * @param anomalies anomalies sorted by descending severity
 * @param nearMisses near-misses in key iteration order
 */
public record DetectionResult(
  Instant detectedAt,
  List<Anomaly> anomalies,
  List<NearMiss> nearMisses
) {

  public DetectionResult {
    anomalies = List.copyOf(anomalies);
    nearMisses = List.copyOf(nearMisses);
  }

  public static DetectionResult empty(Instant detectedAt) {
    return new DetectionResult(detectedAt, List.of(), List.of());
  }
}
