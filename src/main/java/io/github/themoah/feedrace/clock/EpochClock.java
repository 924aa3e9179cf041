package io.github.themoah.feedrace.clock;

/**
 * Source of arrival timestamps shared by every stream runner.
 *
 * <p>Readings are nanoseconds elapsed since one reference instant, so values
 * taken by different runners in the same process can be compared directly.
 * Only relative ordering inside one process is meaningful.
 */
@FunctionalInterface
public interface EpochClock {

  /**
   * Returns the time elapsed since the epoch of this clock.
   *
   * @return elapsed nanoseconds, never negative
   */
  long elapsedNanos();
}
