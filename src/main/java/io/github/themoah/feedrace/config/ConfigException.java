package io.github.themoah.feedrace.config;

/**
 * Fatal configuration problem detected at startup, before any network activity.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
