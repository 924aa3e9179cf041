package io.github.themoah.feedrace.stream;

/**
 * Inbound update without the payload the protocol requires.
 */
public class MalformedUpdateException extends RuntimeException {

  public MalformedUpdateException(String message) {
    super(message);
  }
}
