package io.github.themoah.regdetect.health;

/**
 * Status reported by the liveness and readiness endpoints. Readiness is UP once
 * the alerting job has finished its first cycle.
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
}
