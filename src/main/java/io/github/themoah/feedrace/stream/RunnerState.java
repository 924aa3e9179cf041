package io.github.themoah.feedrace.stream;

/**
 * Lifecycle of a stream runner. Every failure returns to {@link #DISCONNECTED};
 * there is no terminal state.
 */
public enum RunnerState {
  DISCONNECTED("disconnected"),
  CONNECTING("connecting"),
  SUBSCRIBED("subscribed"),
  CONSUMING("consuming");

  private final String value;

  RunnerState(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * True while a subscription is open.
   */
  public boolean isLive() {
    return this == SUBSCRIBED || this == CONSUMING;
  }
}
