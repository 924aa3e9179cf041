package io.github.themoah.feedrace.model;

import io.vertx.core.json.JsonObject;

/**
 * Derived per-stream race statistics. Recomputed on every snapshot, never stored.
 * All latency figures are "time behind winner" in nanoseconds.
 */
public record StreamMetrics(
  StreamIdentity stream,
  int wins,
  int participation,
  double winRatePercent,
  double medianBehindNanos,
  long p90BehindNanos,
  long p95BehindNanos,
  long p99BehindNanos,
  double meanBehindNanos,
  double avgWinningMarginNanos  // mean lead over the runner-up in races this stream won
) {

  /**
   * Converts to JSON with latencies expressed in milliseconds.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("stream", stream.name())
      .put("endpoint", stream.endpoint())
      .put("wins", wins)
      .put("participation", participation)
      .put("winRatePercent", winRatePercent)
      .put("medianBehindMs", toMillis(medianBehindNanos))
      .put("p90BehindMs", toMillis(p90BehindNanos))
      .put("p95BehindMs", toMillis(p95BehindNanos))
      .put("p99BehindMs", toMillis(p99BehindNanos))
      .put("meanBehindMs", toMillis(meanBehindNanos))
      .put("avgWinningMarginMs", toMillis(avgWinningMarginNanos));
  }

  private static double toMillis(double nanos) {
    return nanos / 1_000_000.0;
  }
}
