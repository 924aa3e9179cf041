package io.github.themoah.feedrace.geyser;

import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.vertx.core.Future;

/**
 * Opens subscriptions against one upstream endpoint.
 */
public interface GeyserConnector {

  /**
   * Connects, authenticates and writes the initial subscription request.
   *
   * @param request the subscription filter
   * @return the open session, or a failed future on any transport, auth or
   *     subscription error
   */
  Future<GeyserSession> subscribe(SubscribeRequest request);

  /**
   * Releases transport resources.
   */
  Future<Void> close();
}
