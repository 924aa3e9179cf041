package io.github.themoah.feedrace.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for per-slot race records.
 */
public class SlotRaceRecordTest {

  private static final StreamIdentity A = new StreamIdentity("A", "https://a.example.com");
  private static final StreamIdentity B = new StreamIdentity("B", "https://b.example.com");
  private static final StreamIdentity C = new StreamIdentity("C", "https://c.example.com");

  @Test
  void winner_isFirstFinisherAtPositionOne() {
    SlotRaceRecord record = new SlotRaceRecord(9, A, 100);

    assertEquals(A, record.winner());
    assertEquals(0, record.behindWinnerNanos(A).getAsLong());
    assertTrue(record.winningMarginNanos().isEmpty());
    assertEquals(2, record.recordFinish(B, 160));
    assertEquals(3, record.recordFinish(C, 130));
  }

  @Test
  void winningMargin_usesClosestChallenger() {
    SlotRaceRecord record = new SlotRaceRecord(9, A, 100);
    record.recordFinish(B, 160);
    record.recordFinish(C, 130);

    assertEquals(30, record.winningMarginNanos().getAsLong());
  }

  @Test
  void overwrite_keepsPosition() {
    SlotRaceRecord record = new SlotRaceRecord(9, A, 100);
    record.recordFinish(B, 160);

    assertEquals(2, record.recordFinish(B, 170));
    assertEquals(70, record.behindWinnerNanos(B).getAsLong());
  }

  @Test
  void unfinishedStream_hasNoBehindTime() {
    SlotRaceRecord record = new SlotRaceRecord(9, A, 100);

    assertFalse(record.hasFinished(B));
    assertTrue(record.behindWinnerNanos(B).isEmpty());
  }

  @Test
  void unsignedSlot_renderedUnsigned() {
    SlotRaceRecord record = new SlotRaceRecord(-1L, A, 0);

    assertTrue(record.toString().contains("18446744073709551615"));
  }
}
