package io.github.themoah.feedrace.race;

import io.github.themoah.feedrace.model.SlotRaceRecord;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, first-sighting ordered collection of slot races, unique by slot.
 *
 * <p>Two retention modes:
 * <ul>
 *   <li>ring: once the size exceeds capacity the oldest record is evicted</li>
 *   <li>frozen: new slots are refused once the size reaches capacity, while
 *       records already admitted stay writable</li>
 * </ul>
 */
public class RaceLedger {

  private final int capacity;
  private final boolean frozenAtCapacity;
  private final LinkedHashMap<Long, SlotRaceRecord> records = new LinkedHashMap<>();

  public RaceLedger(int capacity, boolean frozenAtCapacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.capacity = capacity;
    this.frozenAtCapacity = frozenAtCapacity;
  }

  public SlotRaceRecord get(long slot) {
    return records.get(slot);
  }

  public boolean contains(long slot) {
    return records.containsKey(slot);
  }

  /**
   * Returns true if a report for this slot may touch the ledger.
   */
  public boolean admits(long slot) {
    return !frozenAtCapacity || records.size() < capacity || records.containsKey(slot);
  }

  /**
   * Appends a record for a slot not yet present.
   *
   * @return the evicted head record in ring mode, or null if nothing was evicted
   */
  public SlotRaceRecord append(SlotRaceRecord record) {
    if (records.containsKey(record.slot())) {
      throw new IllegalStateException("Slot already tracked: " + Long.toUnsignedString(record.slot()));
    }
    records.put(record.slot(), record);

    if (!frozenAtCapacity && records.size() > capacity) {
      Iterator<Map.Entry<Long, SlotRaceRecord>> oldest = records.entrySet().iterator();
      SlotRaceRecord evicted = oldest.next().getValue();
      oldest.remove();
      return evicted;
    }
    return null;
  }

  public boolean isFull() {
    return records.size() >= capacity;
  }

  public boolean isFrozenAtCapacity() {
    return frozenAtCapacity;
  }

  public int size() {
    return records.size();
  }

  /**
   * Records in first-sighting order. Read-only view, valid only on the owning thread.
   */
  public Collection<SlotRaceRecord> records() {
    return Collections.unmodifiableCollection(records.values());
  }
}
