package io.github.themoah.logspike.model;

/**
 * Aggregation identity. Two events aggregate together iff all three components are equal.
 */
public record PatternKey(
  String service,
  String level,
  String template
) {

  @Override
  public String toString() {
    return service + ":" + level + ":" + template;
  }
}
