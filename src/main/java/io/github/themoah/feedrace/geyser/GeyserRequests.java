package io.github.themoah.feedrace.geyser;

import io.github.themoah.feedrace.config.Commitment;
import io.github.themoah.feedrace.geyser.proto.CommitmentLevel;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequestFilterSlots;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequestPing;

/**
 * Builders for the requests a race client writes upstream.
 */
public final class GeyserRequests {

  /** Name of the single slot filter in every subscription. */
  public static final String SLOT_FILTER_NAME = "client";

  /** Upstream pings carry no id, so every reply uses this one. */
  public static final int PING_REPLY_ID = 1;

  private GeyserRequests() {}

  /**
   * Subscription for slot notifications only, filtered by commitment.
   */
  public static SubscribeRequest slotSubscription(Commitment commitment) {
    return SubscribeRequest.newBuilder()
      .putSlots(SLOT_FILTER_NAME, SubscribeRequestFilterSlots.newBuilder()
        .setFilterByCommitment(true)
        .setInterslotUpdates(false)
        .build())
      .setCommitment(toCommitmentLevel(commitment))
      .build();
  }

  /**
   * Keep-alive reply to a server ping.
   */
  public static SubscribeRequest ping(int id) {
    return SubscribeRequest.newBuilder()
      .setPing(SubscribeRequestPing.newBuilder().setId(id).build())
      .build();
  }

  public static CommitmentLevel toCommitmentLevel(Commitment commitment) {
    return switch (commitment) {
      case PROCESSED -> CommitmentLevel.PROCESSED;
      case CONFIRMED -> CommitmentLevel.CONFIRMED;
      case FINALIZED -> CommitmentLevel.FINALIZED;
    };
  }
}
