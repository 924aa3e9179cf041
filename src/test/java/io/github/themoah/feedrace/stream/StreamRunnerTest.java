package io.github.themoah.feedrace.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedrace.config.Commitment;
import io.github.themoah.feedrace.config.StreamConfig;
import io.github.themoah.feedrace.geyser.GeyserRequests;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdate;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdatePing;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateSlot;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.vertx.core.Vertx;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for StreamRunner's subscribe, consume and reconnect loop against a fake connector.
 */
@ExtendWith(VertxExtension.class)
public class StreamRunnerTest {

  private static final StreamConfig STREAM = StreamConfig.of("alpha", "https://alpha.example.com", "token");
  private static final SubscribeRequest SUBSCRIPTION = GeyserRequests.slotSubscription(Commitment.PROCESSED);
  private static final BackoffPolicy FAST = new BackoffPolicy(5, 2.0, 20, OptionalInt.empty());

  private final AtomicLong ticks = new AtomicLong();

  private StreamRunner runner(Vertx vertx, FakeGeyserConnector connector, BackoffPolicy policy) {
    return new StreamRunner(
      STREAM,
      connector,
      SUBSCRIPTION,
      () -> ticks.addAndGet(1_000),
      new RaceEventChannel(vertx),
      policy
    );
  }

  private static SubscribeUpdate slot(long slot) {
    return SubscribeUpdate.newBuilder()
      .setSlot(SubscribeUpdateSlot.newBuilder().setSlot(slot).setParent(slot - 1).build())
      .build();
  }

  @Test
  void reconnectsAfterFailures_andResumesSlotReports(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(2)
      .onOpen(session -> session.emit(slot(42)));
    StreamRunner runner = runner(vertx, connector, FAST);

    new RaceEventChannel(vertx).consumeReports(report -> testContext.verify(() -> {
      assertEquals(42, report.slot());
      assertEquals("alpha", report.stream().name());
      assertTrue(report.timestampNanos() > 0);
      assertEquals(3, connector.subscribeCalls());
      assertEquals(3, runner.connectAttempts());
      assertEquals(RunnerState.CONSUMING, runner.state());
      assertEquals(1, runner.slotsReported());
      testContext.completeNow();
    }));

    vertx.deployVerticle(runner).onFailure(testContext::failNow);
  }

  @Test
  void slotCounter_currentWhenReportDelivered(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0)
      .onOpen(session -> {
        for (long slot = 1; slot <= 5; slot++) {
          session.emit(slot(slot));
        }
      });
    StreamRunner runner = runner(vertx, connector, FAST);
    Checkpoint delivered = testContext.checkpoint(5);

    new RaceEventChannel(vertx).consumeReports(report -> testContext.verify(() -> {
      assertTrue(runner.slotsReported() >= report.slot(),
        "counter " + runner.slotsReported() + " behind slot " + report.slot());
      delivered.flag();
    }));

    vertx.deployVerticle(runner).onFailure(testContext::failNow);
  }

  @Test
  void sendsSlotSubscriptionOnConnect(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0)
      .onOpen(session -> testContext.verify(() -> {
        assertEquals(SUBSCRIPTION, session.initialRequest);
        assertTrue(session.initialRequest.containsSlots(GeyserRequests.SLOT_FILTER_NAME));
        testContext.completeNow();
      }));

    vertx.deployVerticle(runner(vertx, connector, FAST));
  }

  @Test
  void endOfStream_triggersReconnect(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0);
    connector.onOpen(session -> {
      if (connector.sessions().size() == 1) {
        session.end();
      } else {
        session.emit(slot(7));
      }
    });
    StreamRunner runner = runner(vertx, connector, FAST);

    new RaceEventChannel(vertx).consumeReports(report -> testContext.verify(() -> {
      assertEquals(7, report.slot());
      assertEquals(2, connector.sessions().size());
      assertTrue(connector.sessions().get(0).isClosed());
      testContext.completeNow();
    }));

    vertx.deployVerticle(runner);
  }

  @Test
  void streamError_triggersReconnect(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0);
    connector.onOpen(session -> {
      if (connector.sessions().size() == 1) {
        session.emit(slot(1));
        session.fail(new RuntimeException("connection reset"));
      } else {
        session.emit(slot(2));
      }
    });
    StreamRunner runner = runner(vertx, connector, FAST);

    new RaceEventChannel(vertx).consumeReports(report -> {
      if (report.slot() == 2) {
        testContext.verify(() -> {
          assertEquals(2, runner.slotsReported());
          assertEquals(2, runner.connectAttempts());
          testContext.completeNow();
        });
      }
    });

    vertx.deployVerticle(runner);
  }

  @Test
  void malformedUpdate_dropsSessionAndReconnects(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0);
    connector.onOpen(session -> {
      if (connector.sessions().size() == 1) {
        session.emit(SubscribeUpdate.getDefaultInstance());
      } else {
        testContext.verify(() -> {
          assertTrue(connector.sessions().get(0).isClosed());
          testContext.completeNow();
        });
      }
    });

    vertx.deployVerticle(runner(vertx, connector, FAST));
  }

  @Test
  void serverPing_isAnsweredWithFixedId(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0);
    connector.onOpen(session -> {
      session.emit(SubscribeUpdate.newBuilder().setPing(SubscribeUpdatePing.getDefaultInstance()).build());
      session.context.runOnContext(v -> testContext.verify(() -> {
        assertEquals(1, session.sent.size());
        SubscribeRequest reply = session.sent.get(0);
        assertTrue(reply.hasPing());
        assertEquals(GeyserRequests.PING_REPLY_ID, reply.getPing().getId());
        testContext.completeNow();
      }));
    });

    vertx.deployVerticle(runner(vertx, connector, FAST));
  }

  @Test
  void givesUpWhenAttemptsExhausted(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = FakeGeyserConnector.alwaysFailing();
    StreamRunner runner = runner(vertx, connector, new BackoffPolicy(1, 1.0, 1, OptionalInt.of(2)));

    vertx.deployVerticle(runner).onComplete(testContext.succeeding(id ->
      vertx.setTimer(200, t -> testContext.verify(() -> {
        assertEquals(3, connector.subscribeCalls());
        assertEquals(RunnerState.DISCONNECTED, runner.state());
        testContext.completeNow();
      }))));
  }

  @Test
  void undeploy_closesSessionAndConnector(Vertx vertx, VertxTestContext testContext) {
    FakeGeyserConnector connector = new FakeGeyserConnector(0);
    connector.onOpen(session -> vertx.undeploy(Vertx.currentContext().deploymentID())
      .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
        assertTrue(session.isClosed());
        assertTrue(connector.isClosed());
        testContext.completeNow();
      }))));

    vertx.deployVerticle(runner(vertx, connector, BackoffPolicy.immediate()));
  }
}
