package io.github.themoah.feedrace.stream;

import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconnect delay policy.
 *
 * @param initialDelayMs delay before the first retry
 * @param multiplier growth factor applied after each retry
 * @param maxDelayMs upper bound on any single delay
 * @param maxAttempts retries allowed before giving up, empty for unbounded
 */
public record BackoffPolicy(
  long initialDelayMs,
  double multiplier,
  long maxDelayMs,
  OptionalInt maxAttempts
) {

  private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);

  private static final long DEFAULT_INITIAL_DELAY_MS = 500L;
  private static final double DEFAULT_MULTIPLIER = 1.5;
  private static final long DEFAULT_MAX_DELAY_MS = 60_000L;

  public static final BackoffPolicy DEFAULT = new BackoffPolicy(
    DEFAULT_INITIAL_DELAY_MS, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY_MS, OptionalInt.empty());

  public BackoffPolicy {
    if (initialDelayMs < 0 || maxDelayMs < 0) {
      throw new IllegalArgumentException("Backoff delays must be >= 0");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("Backoff multiplier must be >= 1.0, got " + multiplier);
    }
    if (maxAttempts == null) {
      maxAttempts = OptionalInt.empty();
    }
  }

  /**
   * Policy that retries immediately, forever.
   */
  public static BackoffPolicy immediate() {
    return new BackoffPolicy(0L, 1.0, 0L, OptionalInt.empty());
  }

  public ExponentialBackoff newBackoff() {
    return new ExponentialBackoff(this);
  }

  /**
   * Loads the policy from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>RETRY_INITIAL_DELAY_MS - first delay (default: 500)</li>
   *   <li>RETRY_MULTIPLIER - growth factor (default: 1.5)</li>
   *   <li>RETRY_MAX_DELAY_MS - delay cap (default: 60000)</li>
   *   <li>RETRY_MAX_ATTEMPTS - give up after this many retries (default: unbounded)</li>
   * </ul>
   */
  public static BackoffPolicy fromEnvironment() {
    long initial = parseLong("RETRY_INITIAL_DELAY_MS", DEFAULT_INITIAL_DELAY_MS);
    double multiplier = parseDouble("RETRY_MULTIPLIER", DEFAULT_MULTIPLIER);
    long max = parseLong("RETRY_MAX_DELAY_MS", DEFAULT_MAX_DELAY_MS);
    long attempts = parseLong("RETRY_MAX_ATTEMPTS", 0L);

    if (multiplier < 1.0) {
      log.warn("RETRY_MULTIPLIER must be >= 1.0, using default: {}", DEFAULT_MULTIPLIER);
      multiplier = DEFAULT_MULTIPLIER;
    }
    if (initial < 0 || max < 0) {
      log.warn("Retry delays must be >= 0, using defaults");
      initial = DEFAULT_INITIAL_DELAY_MS;
      max = DEFAULT_MAX_DELAY_MS;
    }

    BackoffPolicy policy = new BackoffPolicy(
      initial,
      multiplier,
      max,
      attempts > 0 ? OptionalInt.of((int) Math.min(attempts, Integer.MAX_VALUE)) : OptionalInt.empty()
    );
    log.info("Retry policy: initialDelayMs={}, multiplier={}, maxDelayMs={}, maxAttempts={}",
      initial, multiplier, max, attempts > 0 ? attempts : "unbounded");
    return policy;
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
