package io.github.themoah.feedrace.geyser;

import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdate;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * An open bidirectional Subscribe call.
 * Handlers are invoked on the context that opened the session.
 */
public interface GeyserSession {

  GeyserSession handler(Handler<SubscribeUpdate> handler);

  GeyserSession exceptionHandler(Handler<Throwable> handler);

  GeyserSession endHandler(Handler<Void> handler);

  /**
   * Writes a request on the outbound half of the call (pings, filter changes).
   */
  Future<Void> send(SubscribeRequest request);

  /**
   * Cancels the call. Safe to call more than once.
   */
  void close();
}
