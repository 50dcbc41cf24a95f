package io.github.themoah.logspike.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Activity surrounding one anomaly, gathered for presentation and explanation.
 *
 * @param anomaly the anomaly being described
 * @param windowStart start of the context window (inclusive)
 * @param windowEnd end of the context window (inclusive), the anomaly's last occurrence
 * @param relatedPatterns raw counts of other keys of the same service inside the window
 * @param levelBreakdown raw counts per level across all keys inside the window
 * @param deployEvent deployment of the same service inside the window, or null
 * @param requestIds request ids of the anomaly's key observed inside the window
 */
public record AnomalyContext(
  Anomaly anomaly,
  Instant windowStart,
  Instant windowEnd,
  Map<PatternKey, Long> relatedPatterns,
  Map<String, Long> levelBreakdown,
  DeployEvent deployEvent,
  List<String> requestIds
) {}
