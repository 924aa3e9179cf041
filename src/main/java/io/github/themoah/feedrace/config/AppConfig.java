package io.github.themoah.feedrace.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-level settings loaded from environment variables.
 *
 * @param httpPort port of the status/metrics HTTP server
 */
public record AppConfig(
  int httpPort
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);

    log.info("AppConfig loaded: httpPort={}", port);
    return new AppConfig(port);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
