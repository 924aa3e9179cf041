package io.github.themoah.feedrace.clock;

/**
 * Production {@link EpochClock} backed by {@link System#nanoTime()}.
 * The epoch is fixed when the instance is created; create exactly one per
 * process and hand it to every runner.
 */
public final class SharedEpochClock implements EpochClock {

  private final long originNanos;

  public SharedEpochClock() {
    this.originNanos = System.nanoTime();
  }

  @Override
  public long elapsedNanos() {
    return System.nanoTime() - originNanos;
  }
}
