package io.github.themoah.feedrace.health;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.feedrace.clock.SharedEpochClock;
import io.github.themoah.feedrace.config.Commitment;
import io.github.themoah.feedrace.config.StreamConfig;
import io.github.themoah.feedrace.geyser.GeyserConnector;
import io.github.themoah.feedrace.geyser.GeyserException;
import io.github.themoah.feedrace.geyser.GeyserRequests;
import io.github.themoah.feedrace.geyser.GeyserSession;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.github.themoah.feedrace.report.RaceStatusHandler;
import io.github.themoah.feedrace.stream.BackoffPolicy;
import io.github.themoah.feedrace.stream.StreamRunner;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * HTTP tests for the probe and race status routes.
 */
@ExtendWith(VertxExtension.class)
public class HealthCheckHandlerTest {

  /** Connector whose endpoint never answers. */
  private static final GeyserConnector UNREACHABLE = new GeyserConnector() {
    @Override
    public Future<GeyserSession> subscribe(SubscribeRequest request) {
      return Future.failedFuture(new GeyserException("unreachable"));
    }

    @Override
    public Future<Void> close() {
      return Future.succeededFuture();
    }
  };

  private Future<HttpServer> startServer(Vertx vertx, List<StreamRunner> runners) {
    Router router = Router.router(vertx);
    new HealthCheckHandler(runners).registerRoutes(router);
    new RaceStatusHandler(new RaceEventChannel(vertx)).registerRoutes(router);
    return vertx.createHttpServer().requestHandler(router).listen(0);
  }

  private Future<HttpClientResponse> get(Vertx vertx, HttpServer server, String path) {
    HttpClient client = vertx.createHttpClient();
    return client.request(HttpMethod.GET, server.actualPort(), "localhost", path)
      .compose(request -> request.send());
  }

  private static StreamRunner idleRunner(Vertx vertx) {
    return new StreamRunner(
      StreamConfig.of("alpha", "https://alpha.example.com", null),
      UNREACHABLE,
      GeyserRequests.slotSubscription(Commitment.PROCESSED),
      new SharedEpochClock(),
      new RaceEventChannel(vertx),
      new BackoffPolicy(60_000, 1.0, 60_000, OptionalInt.empty())
    );
  }

  @Test
  void liveness_alwaysUp(Vertx vertx, VertxTestContext testContext) {
    startServer(vertx, List.of())
      .compose(server -> get(vertx, server, "/healthz"))
      .compose(response -> {
        assertEquals(200, response.statusCode());
        return response.body();
      })
      .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
        assertEquals("UP", new JsonObject(body).getString("status"));
        testContext.completeNow();
      })));
  }

  @Test
  void readiness_downWhileNoStreamSubscribed(Vertx vertx, VertxTestContext testContext) {
    StreamRunner runner = idleRunner(vertx);

    vertx.deployVerticle(runner)
      .compose(id -> startServer(vertx, List.of(runner)))
      .compose(server -> get(vertx, server, "/readyz"))
      .compose(response -> {
        assertEquals(503, response.statusCode());
        return response.body();
      })
      .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
        JsonObject json = new JsonObject(body);
        assertEquals("DOWN", json.getString("status"));
        assertEquals("disconnected", json.getJsonObject("streams").getString("alpha"));
        testContext.completeNow();
      })));
  }

  @Test
  void raceStatus_unavailableWithoutReferee(Vertx vertx, VertxTestContext testContext) {
    startServer(vertx, List.of())
      .compose(server -> get(vertx, server, "/race"))
      .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
        assertEquals(503, response.statusCode());
        testContext.completeNow();
      })));
  }
}
