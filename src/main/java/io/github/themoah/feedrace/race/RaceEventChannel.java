package io.github.themoah.feedrace.race;

import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.model.SlotReport;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Message-passing boundary between runners, the referee and its readers.
 *
 * <p>Slot reports are point-to-point sends to a single local consumer: many
 * producers, one consumer, delivered in enqueue order. Senders never wait for
 * the referee. Snapshots travel back as request/reply so readers never touch
 * race state directly.
 */
public class RaceEventChannel {

  private static final Logger log = LoggerFactory.getLogger(RaceEventChannel.class);

  public static final String SLOT_REPORT_ADDRESS = "feedrace.slot.report";
  public static final String SNAPSHOT_ADDRESS = "feedrace.race.snapshot";
  public static final String COMPLETE_ADDRESS = "feedrace.race.complete";

  private static final DeliveryOptions LOCAL = new DeliveryOptions().setLocalOnly(true);

  private final EventBus eventBus;

  public RaceEventChannel(Vertx vertx) {
    this.eventBus = vertx.eventBus();
    registerCodec(SlotReport.class);
    registerCodec(RaceSnapshot.class);
  }

  /**
   * Enqueues a slot report for the referee. Returns immediately.
   */
  public void reportSlot(SlotReport report) {
    eventBus.send(SLOT_REPORT_ADDRESS, report, LOCAL);
  }

  /**
   * Registers the single consumer of slot reports.
   */
  public MessageConsumer<SlotReport> consumeReports(Handler<SlotReport> handler) {
    return eventBus.<SlotReport>localConsumer(SLOT_REPORT_ADDRESS, msg -> handler.handle(msg.body()));
  }

  /**
   * Asks the referee for a point-in-time snapshot.
   */
  public Future<RaceSnapshot> requestSnapshot() {
    return eventBus.<RaceSnapshot>request(SNAPSHOT_ADDRESS, null, LOCAL).map(Message::body);
  }

  /**
   * Answers snapshot requests from the consumer's own context.
   */
  public MessageConsumer<Object> serveSnapshots(Supplier<RaceSnapshot> snapshots) {
    return eventBus.localConsumer(SNAPSHOT_ADDRESS, msg -> msg.reply(snapshots.get(), LOCAL));
  }

  /**
   * Broadcasts the final snapshot once the ledger stops admitting slots.
   */
  public void announceComplete(RaceSnapshot finalSnapshot) {
    eventBus.publish(COMPLETE_ADDRESS, finalSnapshot, LOCAL);
  }

  public MessageConsumer<RaceSnapshot> onComplete(Handler<RaceSnapshot> handler) {
    return eventBus.<RaceSnapshot>localConsumer(COMPLETE_ADDRESS, msg -> handler.handle(msg.body()));
  }

  private <T> void registerCodec(Class<T> type) {
    try {
      eventBus.registerDefaultCodec(type, new LocalMessageCodec<>(type));
    } catch (IllegalStateException e) {
      // another channel on the same Vert.x instance registered it first
      log.debug("Codec for {} already registered: {}", type.getSimpleName(), e.getMessage());
    }
  }
}
