package io.github.themoah.regdetect.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param alerting alerting job state, "ready" or "pending" (null for liveness check)
 * @param lastCycleMs epoch millis of the last completed alerting cycle (null if none)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String alerting,
  Long lastCycleMs
) {
  /**
   * Creates a liveness response (HTTP server only).
   *
   * @return HealthCheckResponse with UP status
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  /**
   * Creates a readiness response from the alerting job state.
   *
   * @param lastCycleMs epoch millis of the last completed cycle, 0 if none has completed
   * @return UP once a cycle has completed, DOWN before
   */
  public static HealthCheckResponse readiness(long lastCycleMs) {
    boolean ready = lastCycleMs > 0;
    return new HealthCheckResponse(
      ready ? HealthStatus.UP : HealthStatus.DOWN,
      ready ? "ready" : "pending",
      ready ? lastCycleMs : null
    );
  }

  /**
   * Converts to JSON for HTTP response.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (alerting != null) {
      json.put("alerting", alerting);
    }
    if (lastCycleMs != null) {
      json.put("lastCycleMs", lastCycleMs);
    }
    return json;
  }
}
