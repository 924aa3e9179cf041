package io.github.themoah.feedrace.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedrace.metrics.MicrometerReporter;
import io.github.themoah.feedrace.model.StreamIdentity;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.github.themoah.feedrace.race.Referee;
import io.github.themoah.feedrace.race.RefereeVerticle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for PeriodicReporter snapshot polling.
 */
@ExtendWith(VertxExtension.class)
public class PeriodicReporterTest {

  private static final StreamIdentity A = new StreamIdentity("A", "https://a.example.com");

  @Test
  void collect_reportsMetricsWithoutCompletingOpenRace(Vertx vertx, VertxTestContext testContext) {
    RaceEventChannel channel = new RaceEventChannel(vertx);
    Referee referee = new Referee(10, false);
    referee.report(1, A, 100);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    AtomicInteger completions = new AtomicInteger();

    PeriodicReporter reporter = new PeriodicReporter(
      vertx, channel, new RaceSummaryLogger(), new MicrometerReporter(registry), 60_000,
      snapshot -> completions.incrementAndGet());

    vertx.deployVerticle(new RefereeVerticle(referee, channel))
      .compose(id -> reporter.collectAndReport())
      .onComplete(testContext.succeeding(snapshot -> testContext.verify(() -> {
        assertFalse(snapshot.complete());
        assertEquals(1, snapshot.trackedSlots());
        assertEquals(1.0, registry.get("feedrace.slots.tracked").gauge().value());
        assertEquals(0, completions.get());
        testContext.completeNow();
      })));
  }

  @Test
  void collect_signalsCompletionForFullFrozenLedger(Vertx vertx, VertxTestContext testContext) {
    RaceEventChannel channel = new RaceEventChannel(vertx);
    Referee referee = new Referee(1, true, List.of(A));
    referee.report(1, A, 100);

    PeriodicReporter reporter = new PeriodicReporter(
      vertx, channel, new RaceSummaryLogger(), null, 60_000,
      snapshot -> testContext.verify(() -> {
        assertTrue(snapshot.complete());
        testContext.completeNow();
      }));

    vertx.deployVerticle(new RefereeVerticle(referee, channel))
      .compose(id -> reporter.collectAndReport())
      .onFailure(testContext::failNow);
  }

  @Test
  void collect_failsWithoutReferee(Vertx vertx, VertxTestContext testContext) {
    PeriodicReporter reporter = new PeriodicReporter(
      vertx, new RaceEventChannel(vertx), new RaceSummaryLogger(), null, 60_000,
      snapshot -> testContext.failNow("no snapshot expected"));

    reporter.collectAndReport().onComplete(testContext.failing(err -> testContext.completeNow()));
  }

  @Test
  void startAndStop_manageTimer(Vertx vertx, VertxTestContext testContext) {
    PeriodicReporter reporter = new PeriodicReporter(
      vertx, new RaceEventChannel(vertx), new RaceSummaryLogger(), null, 60_000, snapshot -> { });

    reporter.start()
      .compose(v -> reporter.stop())
      .onComplete(testContext.succeedingThenComplete());
  }
}
