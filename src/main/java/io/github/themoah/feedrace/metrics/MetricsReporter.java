package io.github.themoah.feedrace.metrics;

import io.github.themoah.feedrace.model.RaceSnapshot;
import io.vertx.core.Future;

/**
 * Interface for reporting race statistics to external systems.
 */
public interface MetricsReporter {

  /**
   * Reports a race snapshot.
   *
   * @param snapshot the snapshot to publish
   * @return Future that completes when metrics are recorded
   */
  Future<Void> report(RaceSnapshot snapshot);

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();
}
