package io.github.themoah.feedrace.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for health check components.
 */
public class HealthCheckResponseTest {

  @Test
  void healthStatus_values() {
    assertEquals("UP", HealthStatus.UP.getValue());
    assertEquals("DOWN", HealthStatus.DOWN.getValue());
    assertEquals(HealthStatus.UP, HealthStatus.of(true));
    assertEquals(HealthStatus.DOWN, HealthStatus.of(false));
  }

  @Test
  void healthCheckResponse_liveness() {
    HealthCheckResponse response = HealthCheckResponse.liveness();

    assertEquals(HealthStatus.UP, response.status());
    assertTrue(response.streams().isEmpty());
    assertEquals("{\"status\":\"UP\"}", response.toJson().encode());
  }

  @Test
  void healthCheckResponse_readiness_anyStreamLive() {
    Map<String, String> states = new LinkedHashMap<>();
    states.put("alpha", "consuming");
    states.put("beta", "connecting");

    HealthCheckResponse response = HealthCheckResponse.readiness(states, true);

    assertTrue(response.isUp());
    JsonObject json = response.toJson();
    assertEquals("UP", json.getString("status"));
    assertEquals("consuming", json.getJsonObject("streams").getString("alpha"));
    assertEquals("connecting", json.getJsonObject("streams").getString("beta"));
  }

  @Test
  void healthCheckResponse_readiness_noStreamLive() {
    HealthCheckResponse response = HealthCheckResponse.readiness(Map.of("alpha", "disconnected"), false);

    assertFalse(response.isUp());
    assertEquals("DOWN", response.toJson().getString("status"));
  }
}
