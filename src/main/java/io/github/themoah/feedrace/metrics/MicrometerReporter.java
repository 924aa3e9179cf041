package io.github.themoah.feedrace.metrics;

import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.model.StreamMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes race snapshots as Micrometer gauges.
 *
 * <p>Latencies are exported in microseconds and win rates in hundredths of a
 * percent so every gauge stays integral. Gauges for streams that drop out of
 * the ledger are removed after two consecutive misses.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public Future<Void> report(RaceSnapshot snapshot) {
    log.debug("Reporting race metrics for {} streams", snapshot.rankings().size());
    Set<String> activeKeys = new HashSet<>();

    activeKeys.add(recordGauge("feedrace.slots.tracked", Tags.empty(), snapshot.trackedSlots()));
    activeKeys.add(recordGauge("feedrace.races.complete", Tags.empty(), snapshot.completeRaces()));
    activeKeys.add(recordGauge("feedrace.races.partial", Tags.empty(), snapshot.partialRaces()));
    activeKeys.add(recordGauge("feedrace.race.finished", Tags.empty(), snapshot.complete() ? 1 : 0));

    int rank = 1;
    for (StreamMetrics metrics : snapshot.rankings()) {
      Tags streamTags = Tags.of("stream", metrics.stream().name());

      activeKeys.add(recordGauge("feedrace.stream.rank", streamTags, rank++));
      activeKeys.add(recordGauge("feedrace.stream.wins", streamTags, metrics.wins()));
      activeKeys.add(recordGauge("feedrace.stream.participation", streamTags, metrics.participation()));
      activeKeys.add(recordGauge("feedrace.stream.win_rate", streamTags,
        Math.round(metrics.winRatePercent() * 100)));

      activeKeys.add(recordBehind(metrics, "0.5", metrics.medianBehindNanos()));
      activeKeys.add(recordBehind(metrics, "0.9", metrics.p90BehindNanos()));
      activeKeys.add(recordBehind(metrics, "0.95", metrics.p95BehindNanos()));
      activeKeys.add(recordBehind(metrics, "0.99", metrics.p99BehindNanos()));
    }

    cleanupStaleGauges(activeKeys);
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private String recordBehind(StreamMetrics metrics, String quantile, double nanos) {
    Tags tags = Tags.of("stream", metrics.stream().name(), "quantile", quantile);
    return recordGauge("feedrace.stream.behind_winner_us", tags, Math.round(nanos / 1_000.0));
  }

  private String recordGauge(String name, Tags tags, long value) {
    String key = name + tags.toString();
    AtomicLong atomicValue = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return newValue;
    });
    atomicValue.set(value);
    return key;
  }

  /**
   * Two-phase cleanup: a gauge missing from one report is marked, and removed
   * if it is still missing from the next.
   *
   * @param activeKeys gauge keys updated in the current report
   */
  void cleanupStaleGauges(Set<String> activeKeys) {
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activeKeys);
    for (String key : toDelete) {
      removeGauge(key);
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>(gaugeValues.keySet());
    missing.removeAll(activeKeys);
    markedForDeletion.retainAll(missing);
    markedForDeletion.addAll(missing);
  }

  private void removeGauge(String key) {
    AtomicLong value = gaugeValues.remove(key);
    if (value != null) {
      registry.getMeters().stream()
        .filter(meter -> buildMeterKey(meter).equals(key))
        .findFirst()
        .ifPresent(registry::remove);
      log.debug("Removed stale gauge: {}", key);
    }
  }

  private String buildMeterKey(Meter meter) {
    return meter.getId().getName() + Tags.of(meter.getId().getTags()).toString();
  }

  int gaugeCount() {
    return gaugeValues.size();
  }
}
