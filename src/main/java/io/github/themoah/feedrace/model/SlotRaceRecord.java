package io.github.themoah.feedrace.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Race state for a single slot.
 *
 * <p>The winner is whichever stream created the record. Its timestamp is fixed
 * at creation and is never revised, even when a later-processed finish carries
 * an earlier timestamp. Not thread-safe: records are only touched by the
 * referee's consumer.
 */
public final class SlotRaceRecord {

  private final long slot;
  private final StreamIdentity winner;
  private final long winnerTimestampNanos;
  private final Map<StreamIdentity, Long> finishes = new LinkedHashMap<>();

  public SlotRaceRecord(long slot, StreamIdentity winner, long winnerTimestampNanos) {
    this.slot = slot;
    this.winner = winner;
    this.winnerTimestampNanos = winnerTimestampNanos;
    this.finishes.put(winner, winnerTimestampNanos);
  }

  private SlotRaceRecord(SlotRaceRecord other) {
    this.slot = other.slot;
    this.winner = other.winner;
    this.winnerTimestampNanos = other.winnerTimestampNanos;
    this.finishes.putAll(other.finishes);
  }

  public long slot() {
    return slot;
  }

  public StreamIdentity winner() {
    return winner;
  }

  public long winnerTimestampNanos() {
    return winnerTimestampNanos;
  }

  public Map<StreamIdentity, Long> finishes() {
    return Collections.unmodifiableMap(finishes);
  }

  /**
   * Records (or overwrites) a stream's finish time.
   *
   * @return 1-based position of the stream among recorded finishes
   */
  public int recordFinish(StreamIdentity stream, long timestampNanos) {
    finishes.put(stream, timestampNanos);
    int position = 0;
    for (StreamIdentity finished : finishes.keySet()) {
      position++;
      if (finished.equals(stream)) {
        break;
      }
    }
    return position;
  }

  public OptionalLong finishOf(StreamIdentity stream) {
    Long finish = finishes.get(stream);
    return finish == null ? OptionalLong.empty() : OptionalLong.of(finish);
  }

  /**
   * Time between the winner's arrival and this stream's arrival, floored at zero.
   * Returns empty if the stream has not finished this slot.
   */
  public OptionalLong behindWinnerNanos(StreamIdentity stream) {
    OptionalLong finish = finishOf(stream);
    if (finish.isEmpty()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(Math.max(0L, finish.getAsLong() - winnerTimestampNanos));
  }

  /**
   * Gap between the winner and the closest other finisher, floored at zero.
   * Empty while the winner is the only finisher.
   */
  public OptionalLong winningMarginNanos() {
    long best = Long.MAX_VALUE;
    for (Map.Entry<StreamIdentity, Long> entry : finishes.entrySet()) {
      if (!entry.getKey().equals(winner)) {
        best = Math.min(best, Math.max(0L, entry.getValue() - winnerTimestampNanos));
      }
    }
    return best == Long.MAX_VALUE ? OptionalLong.empty() : OptionalLong.of(best);
  }

  public boolean hasFinished(StreamIdentity stream) {
    return finishes.containsKey(stream);
  }

  public int finisherCount() {
    return finishes.size();
  }

  public SlotRaceRecord copy() {
    return new SlotRaceRecord(this);
  }

  @Override
  public String toString() {
    return "SlotRaceRecord{slot=" + Long.toUnsignedString(slot)
      + ", winner=" + winner
      + ", winnerTimestampNanos=" + winnerTimestampNanos
      + ", finishes=" + finishes + "}";
  }
}
