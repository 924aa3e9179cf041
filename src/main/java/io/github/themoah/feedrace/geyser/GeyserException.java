package io.github.themoah.feedrace.geyser;

/**
 * Upstream refused or broke a subscription.
 */
public class GeyserException extends RuntimeException {

  public GeyserException(String message) {
    super(message);
  }
}
