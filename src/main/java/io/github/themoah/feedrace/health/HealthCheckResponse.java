package io.github.themoah.feedrace.health;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param streams runner state per stream name (empty for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  Map<String, String> streams
) {
  public HealthCheckResponse {
    streams = Collections.unmodifiableMap(new LinkedHashMap<>(streams));
  }

  /**
   * Creates a liveness response (HTTP server only).
   *
   * @return HealthCheckResponse with UP status
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, Map.of());
  }

  /**
   * Creates a readiness response. Ready while at least one stream is
   * subscribed or consuming.
   *
   * @param streamStates runner state per stream, in configuration order
   * @param anyLive true if any runner holds a live subscription
   * @return HealthCheckResponse with appropriate status
   */
  public static HealthCheckResponse readiness(Map<String, String> streamStates, boolean anyLive) {
    return new HealthCheckResponse(HealthStatus.of(anyLive), streamStates);
  }

  public boolean isUp() {
    return status == HealthStatus.UP;
  }

  /**
   * Converts to JSON for HTTP response.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (!streams.isEmpty()) {
      JsonObject states = new JsonObject();
      streams.forEach(states::put);
      json.put("streams", states);
    }
    return json;
  }
}
