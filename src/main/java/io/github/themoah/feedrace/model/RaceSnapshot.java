package io.github.themoah.feedrace.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Optional;

/**
 * Immutable point-in-time view of the race, handed out by the referee.
 *
 * @param trackedSlots records currently held in the ledger
 * @param completeRaces records every known stream has finished
 * @param partialRaces records still missing at least one stream
 * @param complete true once a frozen ledger has reached capacity
 * @param rankings per-stream metrics, fastest (lowest median) first
 */
public record RaceSnapshot(
  int trackedSlots,
  int completeRaces,
  int partialRaces,
  boolean complete,
  List<StreamMetrics> rankings
) {

  public RaceSnapshot {
    rankings = List.copyOf(rankings);
  }

  public static RaceSnapshot empty() {
    return new RaceSnapshot(0, 0, 0, false, List.of());
  }

  public Optional<StreamMetrics> fastest() {
    return rankings.isEmpty() ? Optional.empty() : Optional.of(rankings.get(0));
  }

  public JsonObject toJson() {
    JsonArray streams = new JsonArray();
    rankings.forEach(metrics -> streams.add(metrics.toJson()));
    return new JsonObject()
      .put("trackedSlots", trackedSlots)
      .put("completeRaces", completeRaces)
      .put("partialRaces", partialRaces)
      .put("complete", complete)
      .put("streams", streams);
  }
}
