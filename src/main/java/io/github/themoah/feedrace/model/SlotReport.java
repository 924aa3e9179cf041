package io.github.themoah.feedrace.model;

/**
 * Race event emitted by a runner when a slot notification arrives.
 *
 * @param slot slot number (unsigned)
 * @param stream the stream that received the notification
 * @param timestampNanos arrival time on the shared epoch clock
 */
public record SlotReport(
  long slot,
  StreamIdentity stream,
  long timestampNanos
) {}
