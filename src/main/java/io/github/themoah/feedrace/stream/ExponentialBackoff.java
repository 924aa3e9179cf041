package io.github.themoah.feedrace.stream;

/**
 * Mutable retry state for one runner. Delays never decrease between resets
 * and never exceed the policy cap.
 */
public class ExponentialBackoff {

  private final BackoffPolicy policy;
  private long currentDelayMs;
  private int attempts;

  ExponentialBackoff(BackoffPolicy policy) {
    this.policy = policy;
    reset();
  }

  /**
   * Consumes one retry attempt.
   *
   * @return delay to wait before the attempt, in milliseconds
   */
  public long nextDelayMs() {
    long delay = currentDelayMs;
    attempts++;
    // a zero start still grows once the multiplier is above 1
    long base = policy.multiplier() > 1.0 ? Math.max(1L, currentDelayMs) : currentDelayMs;
    double grown = Math.ceil(base * policy.multiplier());
    currentDelayMs = (long) Math.min(policy.maxDelayMs(), grown);
    return delay;
  }

  /**
   * True once the policy's attempt limit has been used up.
   */
  public boolean isExhausted() {
    return policy.maxAttempts().isPresent() && attempts >= policy.maxAttempts().getAsInt();
  }

  /**
   * Starts over from the initial delay, e.g. after a healthy session.
   */
  public void reset() {
    currentDelayMs = Math.min(policy.initialDelayMs(), policy.maxDelayMs());
    attempts = 0;
  }

  public int attempts() {
    return attempts;
  }
}
