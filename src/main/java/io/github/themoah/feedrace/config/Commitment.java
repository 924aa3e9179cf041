package io.github.themoah.feedrace.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Finality tier used to filter upstream slot notifications.
 */
public enum Commitment {
  PROCESSED("processed"),
  CONFIRMED("confirmed"),
  FINALIZED("finalized");

  private final String value;

  Commitment(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a configured commitment level, case-insensitively.
   *
   * @throws ConfigException if the value is not a known level
   */
  public static Commitment fromString(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Commitment commitment : values()) {
        if (commitment.value.equals(normalized)) {
          return commitment;
        }
      }
    }
    String allowed = Arrays.stream(values())
      .map(Commitment::getValue)
      .collect(Collectors.joining(", "));
    throw new ConfigException("Invalid commitment level '" + value + "', expected one of: " + allowed);
  }
}
