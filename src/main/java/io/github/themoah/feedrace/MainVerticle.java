package io.github.themoah.feedrace;

import io.github.themoah.feedrace.clock.EpochClock;
import io.github.themoah.feedrace.clock.SharedEpochClock;
import io.github.themoah.feedrace.config.AppConfig;
import io.github.themoah.feedrace.config.ConfigException;
import io.github.themoah.feedrace.config.RaceConfig;
import io.github.themoah.feedrace.config.StreamConfig;
import io.github.themoah.feedrace.geyser.GeyserRequests;
import io.github.themoah.feedrace.geyser.VertxGeyserConnector;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.health.HealthCheckHandler;
import io.github.themoah.feedrace.metrics.MetricsConfig;
import io.github.themoah.feedrace.metrics.MetricsReporter;
import io.github.themoah.feedrace.metrics.MicrometerConfig;
import io.github.themoah.feedrace.metrics.MicrometerReporter;
import io.github.themoah.feedrace.metrics.PrometheusHandler;
import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.model.StreamIdentity;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.github.themoah.feedrace.race.Referee;
import io.github.themoah.feedrace.race.RefereeVerticle;
import io.github.themoah.feedrace.report.PeriodicReporter;
import io.github.themoah.feedrace.report.RaceStatusHandler;
import io.github.themoah.feedrace.report.RaceSummaryLogger;
import io.github.themoah.feedrace.stream.BackoffPolicy;
import io.github.themoah.feedrace.stream.StreamRunner;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for feedrace.
 * Wires the referee, one runner per configured stream, the periodic reporter
 * and the HTTP server, then hands the final snapshot to the launcher.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final Handler<RaceSnapshot> onRaceComplete;
  private final RaceSummaryLogger summaryLogger = new RaceSummaryLogger();

  private final List<StreamRunner> runners = new ArrayList<>();
  private PeriodicReporter reporter;
  private HttpServer httpServer;
  private boolean finished;

  /**
   * @param onRaceComplete invoked once with the final snapshot when the
   *                       ledger is frozen and full
   */
  public MainVerticle(Handler<RaceSnapshot> onRaceComplete) {
    this.onRaceComplete = onRaceComplete;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting feedrace MainVerticle");

    AppConfig appConfig;
    RaceConfig raceConfig;
    try {
      appConfig = AppConfig.fromEnvironment();
      raceConfig = RaceConfig.load();
    } catch (ConfigException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      startPromise.fail(e);
      return;
    }
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    BackoffPolicy backoffPolicy = BackoffPolicy.fromEnvironment();

    logRaceConfig(raceConfig);

    EpochClock clock = new SharedEpochClock();
    RaceEventChannel channel = new RaceEventChannel(vertx);
    List<StreamIdentity> participants = raceConfig.streams().stream()
      .map(StreamConfig::identity)
      .toList();
    Referee referee = new Referee(raceConfig.maxSlots(), raceConfig.stopAtMax(), participants);

    channel.onComplete(this::finishRace);

    SubscribeRequest subscription = GeyserRequests.slotSubscription(raceConfig.commitment());
    for (StreamConfig stream : raceConfig.streams()) {
      runners.add(new StreamRunner(
        stream,
        new VertxGeyserConnector(vertx, stream),
        subscription,
        clock,
        channel,
        backoffPolicy
      ));
    }

    Router router = Router.router(vertx);
    new HealthCheckHandler(runners).registerRoutes(router);
    new RaceStatusHandler(channel).registerRoutes(router);
    MetricsReporter metricsReporter = createMetricsReporter(metricsConfig, router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    reporter = new PeriodicReporter(
      vertx,
      channel,
      summaryLogger,
      metricsReporter,
      raceConfig.reportIntervalMs(),
      this::finishRace
    );

    vertx.deployVerticle(new RefereeVerticle(referee, channel))
      .compose(id -> deployRunners())
      .compose(v -> reporter.start())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("feedrace started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start feedrace", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping feedrace MainVerticle");

    Future<Void> stopReporter = (reporter != null)
      ? reporter.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopReporter
      .compose(v -> stopHttpServer)
      .onSuccess(v -> {
        log.info("feedrace stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during feedrace shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<Void> deployRunners() {
    List<Future<String>> deployments = new ArrayList<>();
    for (StreamRunner runner : runners) {
      deployments.add(vertx.deployVerticle(runner)
        .onSuccess(id -> log.info("Stream runner {} deployed with ID: {}", runner.identity(), id)));
    }
    return Future.all(deployments).mapEmpty();
  }

  private void finishRace(RaceSnapshot snapshot) {
    if (finished) {
      return;
    }
    finished = true;
    summaryLogger.logFinalSummary(snapshot);
    onRaceComplete.handle(snapshot);
  }

  private void logRaceConfig(RaceConfig config) {
    log.info("Racing {} streams: {}", config.streams().size(), config.streams());
    log.info("Max slots: {}, stop at max: {}, commitment: {}, report interval: {}ms",
      config.maxSlots(), config.stopAtMax(), config.commitment().getValue(), config.reportIntervalMs());
    log.info("Warmup slots: {} (not excluded from statistics)", config.warmupSlots());
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private MetricsReporter createMetricsReporter(MetricsConfig config, Router router) {
    if (!config.enabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    PrometheusMeterRegistry registry = MicrometerConfig.createPrometheusRegistry();
    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }
    new PrometheusHandler(registry).registerRoutes(router);
    return new MicrometerReporter(registry);
  }
}
