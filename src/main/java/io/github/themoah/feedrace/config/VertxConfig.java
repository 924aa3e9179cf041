package io.github.themoah.feedrace.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x runtime options.
 * Event-loop pool size can be raised with VERTX_EVENT_LOOPS so every stream
 * runner gets its own loop when many endpoints race.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOPS = "VERTX_EVENT_LOOPS";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    int eventLoops = eventLoopPoolSize();
    if (eventLoops > 0) {
      log.info("Using {} event loop threads", eventLoops);
      options.setEventLoopPoolSize(eventLoops);
    }
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }

  static int eventLoopPoolSize() {
    String value = System.getenv(ENV_EVENT_LOOPS);
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using Vert.x default", ENV_EVENT_LOOPS, value);
      return 0;
    }
  }
}
