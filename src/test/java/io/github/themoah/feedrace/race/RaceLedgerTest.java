package io.github.themoah.feedrace.race;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedrace.model.SlotRaceRecord;
import io.github.themoah.feedrace.model.StreamIdentity;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RaceLedger retention modes.
 */
public class RaceLedgerTest {

  private static final StreamIdentity STREAM = new StreamIdentity("alpha", "https://alpha.example.com");

  @Test
  void ring_evictsHeadWhenOverCapacity() {
    RaceLedger ledger = new RaceLedger(2, false);

    assertNull(ledger.append(new SlotRaceRecord(1, STREAM, 10)));
    assertNull(ledger.append(new SlotRaceRecord(2, STREAM, 20)));
    SlotRaceRecord evicted = ledger.append(new SlotRaceRecord(3, STREAM, 30));

    assertEquals(1, evicted.slot());
    assertEquals(2, ledger.size());
    assertFalse(ledger.contains(1));
    assertTrue(ledger.admits(99));
  }

  @Test
  void frozen_admitsOnlyKnownSlotsAtCapacity() {
    RaceLedger ledger = new RaceLedger(2, true);
    ledger.append(new SlotRaceRecord(1, STREAM, 10));
    assertTrue(ledger.admits(2));
    ledger.append(new SlotRaceRecord(2, STREAM, 20));

    assertTrue(ledger.isFull());
    assertTrue(ledger.admits(1));
    assertFalse(ledger.admits(3));
  }

  @Test
  void append_duplicateSlotRejected() {
    RaceLedger ledger = new RaceLedger(5, false);
    ledger.append(new SlotRaceRecord(1, STREAM, 10));

    assertThrows(IllegalStateException.class, () -> ledger.append(new SlotRaceRecord(1, STREAM, 11)));
  }

  @Test
  void records_keepFirstSightingOrder() {
    RaceLedger ledger = new RaceLedger(5, false);
    ledger.append(new SlotRaceRecord(30, STREAM, 1));
    ledger.append(new SlotRaceRecord(10, STREAM, 2));
    ledger.append(new SlotRaceRecord(20, STREAM, 3));

    assertEquals(30, ledger.records().iterator().next().slot());
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new RaceLedger(0, false));
  }
}
