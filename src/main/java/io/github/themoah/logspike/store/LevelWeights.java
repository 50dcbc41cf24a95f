package io.github.themoah.logspike.store;

import java.util.Map;

/**
 * Fixed per-level weights applied to recent activity, so that an error burst counts for
 * more than an info burst of the same size.
 */
public final class LevelWeights {

  public static final double DEFAULT_WEIGHT = 1.0;

  private static final Map<String, Double> WEIGHTS = Map.of(
    "ERROR", 5.0,
    "WARN", 2.0,
    "INFO", 1.0,
    "DEBUG", 0.5
  );

  private LevelWeights() {}

  /**
   * Returns the weight of a level label; unrecognized labels weigh {@value #DEFAULT_WEIGHT}.
   */
  public static double weightOf(String level) {
    if (level == null) {
      return DEFAULT_WEIGHT;
    }
    return WEIGHTS.getOrDefault(level, DEFAULT_WEIGHT);
  }
}
