package io.github.themoah.logspike.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A pattern flagged by the anomaly detector.
 *
 * @param key the pattern key
 * @param reason why the key was flagged
 * @param severity ordering key: recent/baseline ratio for spikes, the weighted recent count for new patterns
 * @param recentWeighted level-weighted count inside the recent window
 * @param baselineWeighted average raw per-bucket count before the recent window
 * @param firstSeen lifetime first occurrence
 * @param lastSeen lifetime last occurrence
 */
public record Anomaly(
  PatternKey key,
  Reason reason,
  double severity,
  double recentWeighted,
  double baselineWeighted,
  Instant firstSeen,
  Instant lastSeen
) {

  public Anomaly {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(reason, "reason cannot be null");
  }

  /**
   * Classification of an anomaly.
   */
  public enum Reason {
    SPIKE("spike"),
    NEW_PATTERN("new_pattern");

    private final String value;

    Reason(String value) {
      this.value = value;
    }

    public String getValue() {
      return value;
    }
  }
}
