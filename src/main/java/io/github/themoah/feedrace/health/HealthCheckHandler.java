package io.github.themoah.feedrace.health;

import io.github.themoah.feedrace.stream.RunnerState;
import io.github.themoah.feedrace.stream.StreamRunner;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final List<StreamRunner> runners;

  public HealthCheckHandler(List<StreamRunner> runners) {
    this.runners = List.copyOf(runners);
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  /**
   * Builds the readiness view from the current runner states.
   */
  public HealthCheckResponse readiness() {
    Map<String, String> states = new LinkedHashMap<>();
    boolean anyLive = false;
    for (StreamRunner runner : runners) {
      RunnerState state = runner.state();
      states.put(runner.identity().name(), state.getValue());
      anyLive |= state.isLive();
    }
    return HealthCheckResponse.readiness(states, anyLive);
  }

  private void handleLiveness(RoutingContext ctx) {
    HealthCheckResponse response = HealthCheckResponse.liveness();
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(response.toJson().encode());
  }

  /**
   * Readiness probe: 200 while any stream is subscribed, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    HealthCheckResponse response = readiness();
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.isUp() ? 200 : 503)
      .end(response.toJson().encode());
  }
}
