package io.github.themoah.logspike.model;

import java.util.Objects;

/**
 * A key whose recent activity approached, but did not cross, the spike threshold.
 */
public record NearMiss(
  PatternKey key,
  double recentWeighted,
  double baselineWeighted,
  double threshold
) {

  public NearMiss {
    Objects.requireNonNull(key, "key cannot be null");
  }
}
