package io.github.themoah.feedrace.race;

import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.model.SlotRaceRecord;
import io.github.themoah.feedrace.model.StreamIdentity;
import io.github.themoah.feedrace.model.StreamMetrics;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides per-slot race winners and computes cross-stream latency statistics.
 *
 * <p>Not thread-safe. A single owner (the {@link RefereeVerticle}) feeds it one
 * report at a time; processing order decides the winner, not the timestamps
 * the reports carry.
 */
public class Referee {

  private static final Logger log = LoggerFactory.getLogger(Referee.class);

  private final RaceLedger ledger;
  private final Set<StreamIdentity> participants;

  public Referee(int maxSlots, boolean stopAtMax) {
    this(maxSlots, stopAtMax, List.of());
  }

  /**
   * @param maxSlots ledger capacity
   * @param stopAtMax freeze the ledger at capacity instead of evicting
   * @param participants configured streams; a race counts as complete once all of them finished
   */
  public Referee(int maxSlots, boolean stopAtMax, Collection<StreamIdentity> participants) {
    this.ledger = new RaceLedger(maxSlots, stopAtMax);
    this.participants = new LinkedHashSet<>(participants);
  }

  /**
   * Records a slot arrival.
   *
   * @return false if the ledger is frozen at capacity and the slot is new
   *     (nothing was recorded), true otherwise
   */
  public boolean report(long slot, StreamIdentity stream, long timestampNanos) {
    Objects.requireNonNull(stream, "stream cannot be null");

    if (!ledger.admits(slot)) {
      log.debug("Slot {} from {} dropped, ledger frozen at {} slots",
        Long.toUnsignedString(slot), stream, ledger.size());
      return false;
    }

    participants.add(stream);
    SlotRaceRecord existing = ledger.get(slot);

    if (existing == null) {
      SlotRaceRecord evicted = ledger.append(new SlotRaceRecord(slot, stream, timestampNanos));
      log.info("Slot {} first received by {} at {}ms",
        Long.toUnsignedString(slot), stream, LatencyStats.formatMillis(timestampNanos));
      if (evicted != null) {
        log.debug("Evicted slot {} from ledger", Long.toUnsignedString(evicted.slot()));
      }
      return true;
    }

    int position = existing.recordFinish(stream, timestampNanos);
    long behind = existing.behindWinnerNanos(stream).orElse(0L);
    log.info("Slot {} position {}: {} at {}ms, {}ms behind {}",
      Long.toUnsignedString(slot),
      position,
      stream,
      LatencyStats.formatMillis(timestampNanos),
      LatencyStats.formatMillis(behind),
      existing.winner());
    return true;
  }

  /**
   * True once a frozen ledger has reached capacity.
   */
  public boolean isComplete() {
    return ledger.isFrozenAtCapacity() && ledger.isFull();
  }

  /**
   * Computes per-stream statistics over the current ledger.
   * Streams without any finish in the ledger are left out.
   *
   * @return metrics sorted by median time behind winner, fastest first
   */
  public List<StreamMetrics> snapshotMetrics() {
    List<StreamMetrics> metrics = new ArrayList<>();

    for (StreamIdentity stream : participants) {
      List<Long> behindTimes = new ArrayList<>();
      List<Long> winningMargins = new ArrayList<>();
      int wins = 0;

      for (SlotRaceRecord record : ledger.records()) {
        OptionalLong behind = record.behindWinnerNanos(stream);
        if (behind.isEmpty()) {
          continue;
        }
        behindTimes.add(behind.getAsLong());
        if (record.winner().equals(stream)) {
          wins++;
          record.winningMarginNanos().ifPresent(winningMargins::add);
        }
      }

      if (behindTimes.isEmpty()) {
        continue;
      }

      int participation = behindTimes.size();
      metrics.add(new StreamMetrics(
        stream,
        wins,
        participation,
        wins * 100.0 / participation,
        LatencyStats.median(behindTimes),
        LatencyStats.tailPercentile(behindTimes, LatencyStats.P90_TAIL),
        LatencyStats.tailPercentile(behindTimes, LatencyStats.P95_TAIL),
        LatencyStats.tailPercentile(behindTimes, LatencyStats.P99_TAIL),
        LatencyStats.mean(behindTimes),
        LatencyStats.mean(winningMargins)
      ));
    }

    metrics.sort(Comparator.comparingDouble(StreamMetrics::medianBehindNanos));
    return List.copyOf(metrics);
  }

  /**
   * Builds an immutable snapshot of ledger totals and per-stream metrics.
   */
  public RaceSnapshot snapshot() {
    int complete = 0;
    for (SlotRaceRecord record : ledger.records()) {
      if (record.finishes().keySet().containsAll(participants)) {
        complete++;
      }
    }
    return new RaceSnapshot(
      ledger.size(),
      complete,
      ledger.size() - complete,
      isComplete(),
      snapshotMetrics()
    );
  }

  /**
   * Returns a detached copy of the record for a slot.
   */
  public Optional<SlotRaceRecord> record(long slot) {
    SlotRaceRecord record = ledger.get(slot);
    return record == null ? Optional.empty() : Optional.of(record.copy());
  }

  /**
   * Slots in the ledger, oldest first.
   */
  public List<Long> trackedSlots() {
    List<Long> slots = new ArrayList<>(ledger.size());
    ledger.records().forEach(record -> slots.add(record.slot()));
    return slots;
  }

  public int size() {
    return ledger.size();
  }
}
