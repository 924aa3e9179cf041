package io.github.themoah.feedrace.stream;

import io.github.themoah.feedrace.clock.EpochClock;
import io.github.themoah.feedrace.config.StreamConfig;
import io.github.themoah.feedrace.geyser.GeyserConnector;
import io.github.themoah.feedrace.geyser.GeyserRequests;
import io.github.themoah.feedrace.geyser.GeyserSession;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdate;
import io.github.themoah.feedrace.model.SlotReport;
import io.github.themoah.feedrace.model.StreamIdentity;
import io.github.themoah.feedrace.race.RaceEventChannel;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connect, subscribe and consume loop for one upstream endpoint.
 *
 * <p>Runs as its own verticle so each endpoint has an independent lifecycle.
 * Any transport error, malformed update or end of stream drops the session and
 * schedules a reconnect through {@link ExponentialBackoff}. Slot notifications
 * are stamped on the shared {@link EpochClock} before anything else happens and
 * sent to the referee without waiting.
 */
public class StreamRunner extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(StreamRunner.class);

  private final StreamConfig config;
  private final StreamIdentity identity;
  private final GeyserConnector connector;
  private final SubscribeRequest subscribeRequest;
  private final EpochClock clock;
  private final RaceEventChannel channel;
  private final ExponentialBackoff backoff;
  private final UpdateLogger updateLogger;

  private final AtomicReference<RunnerState> state = new AtomicReference<>(RunnerState.DISCONNECTED);
  private final AtomicLong slotsReported = new AtomicLong();
  private final AtomicLong connectAttempts = new AtomicLong();

  private GeyserSession session;
  private Long retryTimerId;
  private boolean stopped;

  public StreamRunner(
    StreamConfig config,
    GeyserConnector connector,
    SubscribeRequest subscribeRequest,
    EpochClock clock,
    RaceEventChannel channel,
    BackoffPolicy backoffPolicy
  ) {
    this.config = config;
    this.identity = config.identity();
    this.connector = connector;
    this.subscribeRequest = subscribeRequest;
    this.clock = clock;
    this.channel = channel;
    this.backoff = backoffPolicy.newBackoff();
    this.updateLogger = new UpdateLogger(config.name());
  }

  @Override
  public void start() {
    connect();
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    stopped = true;
    if (retryTimerId != null) {
      vertx.cancelTimer(retryTimerId);
      retryTimerId = null;
    }
    if (session != null) {
      session.close();
      session = null;
    }
    transition(RunnerState.DISCONNECTED);
    connector.close()
      .onComplete(ar -> {
        log.info("[{}] Runner stopped after {} slot reports", identity, slotsReported.get());
        stopPromise.complete();
      });
  }

  public StreamIdentity identity() {
    return identity;
  }

  public RunnerState state() {
    return state.get();
  }

  public long slotsReported() {
    return slotsReported.get();
  }

  public long connectAttempts() {
    return connectAttempts.get();
  }

  private void connect() {
    retryTimerId = null;
    if (stopped) {
      return;
    }

    transition(RunnerState.CONNECTING);
    connectAttempts.incrementAndGet();
    log.info("[{}] Connecting to gRPC endpoint: {}", identity, config.endpoint());

    Future<GeyserSession> subscription;
    try {
      subscription = connector.subscribe(subscribeRequest);
    } catch (RuntimeException e) {
      subscription = Future.failedFuture(e);
    }
    subscription
      .onSuccess(this::onSubscribed)
      .onFailure(err -> scheduleRetry("Connection failed", err));
  }

  private void onSubscribed(GeyserSession opened) {
    if (stopped) {
      opened.close();
      return;
    }

    session = opened;
    transition(RunnerState.SUBSCRIBED);
    log.info("[{}] Subscribed to slot updates, waiting for messages...", identity);

    opened.handler(update -> handleUpdate(opened, update))
      .exceptionHandler(err -> sessionLost(opened, "Stream error", err))
      .endHandler(v -> sessionLost(opened, "Stream closed", null));
  }

  void handleUpdate(GeyserSession source, SubscribeUpdate update) {
    long receivedAt = clock.elapsedNanos();

    if (source != session) {
      return;
    }
    if (state.get() != RunnerState.CONSUMING) {
      transition(RunnerState.CONSUMING);
      backoff.reset();
    }

    switch (update.getUpdateOneofCase()) {
      case SLOT -> {
        long slot = update.getSlot().getSlot();
        slotsReported.incrementAndGet();
        channel.reportSlot(new SlotReport(slot, identity, receivedAt));
        if (log.isDebugEnabled()) {
          log.debug("[{}] Slot update: slot={}, parent={}, status={}, received_at={}ns",
            identity,
            Long.toUnsignedString(slot),
            Long.toUnsignedString(update.getSlot().getParent()),
            update.getSlot().getStatus(),
            receivedAt);
        }
      }
      case PING -> {
        log.info("[{}] Received ping from server - replying to keep connection alive", identity);
        source.send(GeyserRequests.ping(GeyserRequests.PING_REPLY_ID))
          .onFailure(err -> sessionLost(source, "Ping reply failed", err));
      }
      case PONG -> log.info("[{}] Received pong response with id: {}", identity, update.getPong().getId());
      case ACCOUNT -> updateLogger.logAccount(update.getAccount());
      case TRANSACTION -> updateLogger.logTransaction(update.getTransaction());
      case TRANSACTION_STATUS -> updateLogger.logTransactionStatus(update.getTransactionStatus());
      case BLOCK -> updateLogger.logBlock(update.getBlock());
      case BLOCK_META -> updateLogger.logBlockMeta(update.getBlockMeta());
      case ENTRY -> updateLogger.logEntry(update.getEntry());
      case UPDATEONEOF_NOT_SET -> {
        log.error("[{}] update not found in the message", identity);
        sessionLost(source, "Malformed update", new MalformedUpdateException("Update not found in message"));
      }
      default -> log.warn("[{}] Received unknown update type: {}", identity, update.getUpdateOneofCase());
    }
  }

  private void sessionLost(GeyserSession lost, String reason, Throwable cause) {
    if (lost != session) {
      return;
    }
    session = null;
    lost.close();
    scheduleRetry(reason, cause);
  }

  private void scheduleRetry(String reason, Throwable cause) {
    transition(RunnerState.DISCONNECTED);
    if (stopped) {
      return;
    }

    String detail = cause != null ? cause.getMessage() : "end of stream";
    if (backoff.isExhausted()) {
      log.error("[{}] {}: {}. Giving up after {} retries", identity, reason, detail, backoff.attempts());
      return;
    }

    long delayMs = backoff.nextDelayMs();
    log.error("[{}] {}, will retry in {}ms (attempt {}): {}",
      identity, reason, delayMs, backoff.attempts(), detail);

    if (delayMs < 1) {
      context.runOnContext(v -> connect());
    } else {
      retryTimerId = vertx.setTimer(delayMs, id -> connect());
    }
  }

  private void transition(RunnerState next) {
    RunnerState previous = state.getAndSet(next);
    if (previous != next) {
      log.debug("[{}] {} -> {}", identity, previous.getValue(), next.getValue());
    }
  }
}
