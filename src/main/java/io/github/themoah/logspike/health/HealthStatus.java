package io.github.themoah.logspike.health;

/**
 * Health of the service or one of its inputs.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }
}
