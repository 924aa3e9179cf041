package io.github.themoah.feedrace.report;

import io.github.themoah.feedrace.race.RaceEventChannel;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler exposing the current race snapshot as JSON.
 */
public class RaceStatusHandler {

  private static final Logger log = LoggerFactory.getLogger(RaceStatusHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final RaceEventChannel channel;

  public RaceStatusHandler(RaceEventChannel channel) {
    this.channel = channel;
  }

  /**
   * Registers the /race route on the router.
   */
  public void registerRoutes(Router router) {
    router.get("/race").handler(this::handleRace);
    log.info("Registered race status endpoint at /race");
  }

  private void handleRace(RoutingContext ctx) {
    channel.requestSnapshot()
      .onSuccess(snapshot -> ctx.response()
        .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
        .setStatusCode(200)
        .end(snapshot.toJson().encode()))
      .onFailure(err -> {
        log.warn("Race snapshot unavailable: {}", err.getMessage());
        ctx.response()
          .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
          .setStatusCode(503)
          .end(new JsonObject().put("error", "race snapshot unavailable").encode());
      });
  }
}
