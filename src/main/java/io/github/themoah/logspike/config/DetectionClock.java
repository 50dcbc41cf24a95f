package io.github.themoah.logspike.config;

/**
 * Source of the "now" used by periodic detection.
 */
public enum DetectionClock {
  /** Latest event timestamp seen by the store; suits replays of historical logs. */
  EVENT("event"),
  /** System clock; suits live tails. */
  WALL("wall");

  private final String value;

  DetectionClock(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a clock name, case-insensitively.
   *
   * @return the clock, or null if the name is unknown
   */
  public static DetectionClock fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (DetectionClock clock : values()) {
      if (clock.value.equalsIgnoreCase(value.strip())) {
        return clock;
      }
    }
    return null;
  }
}
