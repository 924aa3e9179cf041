package io.github.themoah.feedrace.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics export settings loaded from environment variables.
 *
 * @param enabled expose race gauges on /metrics
 * @param jvmMetricsEnabled also bind JVM memory, GC, thread and CPU metrics
 */
public record MetricsConfig(
  boolean enabled,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  public static MetricsConfig fromEnvironment() {
    boolean enabled = getEnvBool("METRICS_ENABLED", true);
    boolean jvm = getEnvBool("METRICS_JVM_ENABLED", false);

    log.info("MetricsConfig loaded: enabled={}, jvmMetricsEnabled={}", enabled, jvm);
    return new MetricsConfig(enabled, jvm);
  }

  private static boolean getEnvBool(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value.trim());
  }
}
