package io.github.themoah.feedrace.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Race configuration: the competing streams and the race parameters.
 *
 * <p>Read from a properties file, then overridden by environment variables.
 * Every problem is reported as a {@link ConfigException}.
 *
 * @param streams configured streams in declaration order, never empty
 * @param maxSlots ledger capacity
 * @param stopAtMax freeze the ledger at capacity instead of evicting
 * @param commitment commitment level for the slot subscription
 * @param warmupSlots configured warmup length (read and reported, not applied)
 * @param reportIntervalMs periodic summary interval
 */
public record RaceConfig(
  List<StreamConfig> streams,
  int maxSlots,
  boolean stopAtMax,
  Commitment commitment,
  int warmupSlots,
  long reportIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(RaceConfig.class);

  public static final String DEFAULT_CONFIG_FILE = "feedrace.properties";
  public static final String ENV_CONFIG_FILE = "FEEDRACE_CONFIG";

  static final String PROP_STREAMS = "streams";
  static final String PROP_STREAM_PREFIX = "stream.";
  static final String PROP_ENDPOINT = ".endpoint";
  static final String PROP_ACCESS_TOKEN = ".access-token";
  static final String PROP_MAX_SLOTS = "race.max-slots";
  static final String PROP_STOP_AT_MAX = "race.stop-at-max";
  static final String PROP_COMMITMENT = "race.commitment";
  static final String PROP_WARMUP_SLOTS = "race.warmup-slots";
  static final String PROP_REPORT_INTERVAL_MS = "race.report-interval-ms";

  static final String ENV_MAX_SLOTS = "RACE_MAX_SLOTS";
  static final String ENV_STOP_AT_MAX = "RACE_STOP_AT_MAX";
  static final String ENV_COMMITMENT = "RACE_COMMITMENT";
  static final String ENV_REPORT_INTERVAL_MS = "RACE_REPORT_INTERVAL_MS";

  public static final int DEFAULT_MAX_SLOTS = 360;
  public static final boolean DEFAULT_STOP_AT_MAX = false;
  public static final Commitment DEFAULT_COMMITMENT = Commitment.PROCESSED;
  public static final int DEFAULT_WARMUP_SLOTS = 10;
  public static final long DEFAULT_REPORT_INTERVAL_MS = 30_000L;

  public RaceConfig {
    if (streams == null || streams.isEmpty()) {
      throw new ConfigException("No streams configured");
    }
    streams = List.copyOf(streams);
    if (maxSlots < 1) {
      throw new ConfigException("max-slots must be >= 1, got " + maxSlots);
    }
    if (warmupSlots < 0) {
      throw new ConfigException("warmup-slots must be >= 0, got " + warmupSlots);
    }
    if (reportIntervalMs < 1) {
      throw new ConfigException("report-interval-ms must be >= 1, got " + reportIntervalMs);
    }
    if (commitment == null) {
      commitment = DEFAULT_COMMITMENT;
    }
  }

  /**
   * Loads the file named by {@code FEEDRACE_CONFIG}, or {@code feedrace.properties}
   * from the classpath, and applies environment overrides.
   */
  public static RaceConfig load() {
    String file = System.getenv(ENV_CONFIG_FILE);
    Properties props = (file != null && !file.isBlank())
      ? readFile(Path.of(file))
      : readClasspath(DEFAULT_CONFIG_FILE);
    return fromProperties(props, System.getenv());
  }

  public static RaceConfig fromFile(Path path) {
    return fromProperties(readFile(path), Map.of());
  }

  public static RaceConfig fromClasspath(String resourceName) {
    return fromProperties(readClasspath(resourceName), Map.of());
  }

  /**
   * Builds configuration from properties, letting environment values win.
   *
   * @param props race properties
   * @param env environment overrides (RACE_* variables)
   */
  public static RaceConfig fromProperties(Properties props, Map<String, String> env) {
    List<StreamConfig> streams = parseStreams(props);

    int maxSlots = intValue(PROP_MAX_SLOTS, props.getProperty(PROP_MAX_SLOTS), DEFAULT_MAX_SLOTS);
    boolean stopAtMax = boolValue(PROP_STOP_AT_MAX, props.getProperty(PROP_STOP_AT_MAX), DEFAULT_STOP_AT_MAX);
    String commitment = props.getProperty(PROP_COMMITMENT, DEFAULT_COMMITMENT.getValue());
    int warmupSlots = intValue(PROP_WARMUP_SLOTS, props.getProperty(PROP_WARMUP_SLOTS), DEFAULT_WARMUP_SLOTS);
    long reportIntervalMs = longValue(
      PROP_REPORT_INTERVAL_MS, props.getProperty(PROP_REPORT_INTERVAL_MS), DEFAULT_REPORT_INTERVAL_MS);

    maxSlots = envInt(env, ENV_MAX_SLOTS, maxSlots);
    stopAtMax = envBool(env, ENV_STOP_AT_MAX, stopAtMax);
    reportIntervalMs = envLong(env, ENV_REPORT_INTERVAL_MS, reportIntervalMs);
    String envCommitment = env.get(ENV_COMMITMENT);
    if (envCommitment != null && !envCommitment.isBlank()) {
      commitment = envCommitment;
    }

    RaceConfig config = new RaceConfig(
      streams,
      maxSlots,
      stopAtMax,
      Commitment.fromString(commitment),
      warmupSlots,
      reportIntervalMs
    );
    log.info("Race config loaded: streams={}, maxSlots={}, stopAtMax={}, commitment={}",
      streams.size(), maxSlots, stopAtMax, config.commitment().getValue());
    return config;
  }

  private static List<StreamConfig> parseStreams(Properties props) {
    String names = props.getProperty(PROP_STREAMS, "");
    Set<String> unique = new LinkedHashSet<>();
    for (String name : names.split(",")) {
      String trimmed = name.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (!unique.add(trimmed)) {
        throw new ConfigException("Stream '" + trimmed + "' is configured twice");
      }
    }
    if (unique.isEmpty()) {
      throw new ConfigException("No streams configured (property '" + PROP_STREAMS + "' is empty)");
    }

    List<StreamConfig> streams = new ArrayList<>();
    for (String name : unique) {
      streams.add(StreamConfig.of(
        name,
        props.getProperty(PROP_STREAM_PREFIX + name + PROP_ENDPOINT),
        props.getProperty(PROP_STREAM_PREFIX + name + PROP_ACCESS_TOKEN)
      ));
    }
    return streams;
  }

  private static Properties readFile(Path path) {
    log.info("Loading race configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return props;
    } catch (IOException e) {
      throw new ConfigException("Failed to read " + path + ": " + e.getMessage(), e);
    }
  }

  private static Properties readClasspath(String resourceName) {
    log.info("Loading race configuration from classpath: {}", resourceName);
    try (InputStream is = RaceConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new ConfigException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return props;
    } catch (IOException e) {
      throw new ConfigException("Failed to read " + resourceName + ": " + e.getMessage(), e);
    }
  }

  private static int intValue(String key, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid integer for " + key + ": " + value, e);
    }
  }

  private static long longValue(String key, String value, long defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid long for " + key + ": " + value, e);
    }
  }

  private static boolean boolValue(String key, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigException("Invalid boolean for " + key + ": " + value);
  }

  private static int envInt(Map<String, String> env, String name, int defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long envLong(Map<String, String> env, String name, long defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static boolean envBool(Map<String, String> env, String name, boolean defaultValue) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value.trim());
  }
}
