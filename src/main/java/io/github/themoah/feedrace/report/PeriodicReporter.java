package io.github.themoah.feedrace.report;

import io.github.themoah.feedrace.metrics.MetricsReporter;
import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically requests a race snapshot from the referee, logs the ranked
 * summary and forwards it to the metrics reporter.
 * Signals completion once a snapshot reports the frozen ledger as full.
 */
public class PeriodicReporter {

  private static final Logger log = LoggerFactory.getLogger(PeriodicReporter.class);

  private final Vertx vertx;
  private final RaceEventChannel channel;
  private final RaceSummaryLogger summaryLogger;
  private final MetricsReporter metricsReporter;
  private final long intervalMs;
  private final Handler<RaceSnapshot> completionHandler;

  private Long timerId;

  /**
   * @param metricsReporter metrics sink, or null when metrics are disabled
   * @param completionHandler invoked with the snapshot that reports completion
   */
  public PeriodicReporter(
    Vertx vertx,
    RaceEventChannel channel,
    RaceSummaryLogger summaryLogger,
    MetricsReporter metricsReporter,
    long intervalMs,
    Handler<RaceSnapshot> completionHandler
  ) {
    this.vertx = vertx;
    this.channel = channel;
    this.summaryLogger = summaryLogger;
    this.metricsReporter = metricsReporter;
    this.intervalMs = intervalMs;
    this.completionHandler = completionHandler;
  }

  /**
   * Starts the reporter with periodic collection.
   */
  public Future<Void> start() {
    log.info("Starting race reporter with interval: {}ms", intervalMs);

    Future<Void> started = metricsReporter != null
      ? metricsReporter.start()
      : Future.succeededFuture();

    return started.onComplete(ar -> {
      timerId = vertx.setPeriodic(intervalMs, id -> collectAndReport());
      log.info("Race reporter started, timer ID: {}", timerId);
    });
  }

  /**
   * Stops the reporter.
   */
  public Future<Void> stop() {
    log.info("Stopping race reporter");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return metricsReporter != null ? metricsReporter.close() : Future.succeededFuture();
  }

  Future<RaceSnapshot> collectAndReport() {
    log.debug("Requesting race snapshot");

    return channel.requestSnapshot()
      .onSuccess(snapshot -> {
        summaryLogger.logSummary(snapshot);
        if (metricsReporter != null) {
          metricsReporter.report(snapshot)
            .onFailure(err -> log.warn("Failed to report race metrics: {}", err.getMessage()));
        }
        if (snapshot.complete()) {
          completionHandler.handle(snapshot);
        }
      })
      .onFailure(err -> log.error("Failed to collect race snapshot", err));
  }
}
