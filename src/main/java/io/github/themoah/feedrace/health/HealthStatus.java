package io.github.themoah.feedrace.health;

/**
 * Represents the health status of a component.
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
