package io.github.themoah.feedrace.report;

import io.github.themoah.feedrace.model.RaceSnapshot;
import io.github.themoah.feedrace.model.StreamMetrics;
import io.github.themoah.feedrace.race.LatencyStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders race snapshots as a ranked, human-readable summary.
 */
public class RaceSummaryLogger {

  private static final Logger log = LoggerFactory.getLogger(RaceSummaryLogger.class);

  public void logSummary(RaceSnapshot snapshot) {
    formatSummary(snapshot, "RACE SUMMARY").forEach(log::info);
  }

  public void logFinalSummary(RaceSnapshot snapshot) {
    formatSummary(snapshot, "FINAL RACE SUMMARY").forEach(log::info);
  }

  /**
   * Builds the summary lines for a snapshot.
   *
   * @param snapshot the snapshot to render
   * @param title banner title
   * @return lines in display order
   */
  public List<String> formatSummary(RaceSnapshot snapshot, String title) {
    List<String> lines = new ArrayList<>();
    lines.add("=== " + title + " ===");
    lines.add("Total slots tracked: " + snapshot.trackedSlots());
    lines.add("Completed races: " + snapshot.completeRaces() + " (partial: " + snapshot.partialRaces() + ")");

    int rank = 1;
    for (StreamMetrics metrics : snapshot.rankings()) {
      lines.add(String.format(Locale.ROOT,
        "#%d %s: wins %d/%d (%.1f%%), behind winner median %sms, p90 %sms, p95 %sms, p99 %sms",
        rank++,
        metrics.stream().name(),
        metrics.wins(),
        metrics.participation(),
        metrics.winRatePercent(),
        LatencyStats.formatMillis(metrics.medianBehindNanos()),
        LatencyStats.formatMillis(metrics.p90BehindNanos()),
        LatencyStats.formatMillis(metrics.p95BehindNanos()),
        LatencyStats.formatMillis(metrics.p99BehindNanos())));
      if (metrics.wins() > 0 && metrics.avgWinningMarginNanos() > 0) {
        lines.add("    " + metrics.stream().name() + " average winning margin: "
          + LatencyStats.formatMillis(metrics.avgWinningMarginNanos()) + "ms");
      }
    }

    lines.add(verdict(snapshot));
    lines.add("==================");
    return lines;
  }

  static String verdict(RaceSnapshot snapshot) {
    List<StreamMetrics> rankings = snapshot.rankings();
    if (rankings.isEmpty()) {
      return ">>> No races recorded yet";
    }
    StreamMetrics fastest = rankings.get(0);
    if (rankings.size() == 1) {
      return ">>> Only " + fastest.stream().name() + " has reported so far";
    }
    StreamMetrics runnerUp = rankings.get(1);
    double lead = runnerUp.medianBehindNanos() - fastest.medianBehindNanos();
    if (lead <= 0.0) {
      return ">>> " + fastest.stream().name() + " and " + runnerUp.stream().name()
        + " are tied on median latency";
    }
    return ">>> " + fastest.stream().name() + " is faster overall, leading "
      + runnerUp.stream().name() + " by " + LatencyStats.formatMillis(lead) + "ms median";
  }
}
