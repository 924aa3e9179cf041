package io.github.themoah.feedrace.race;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Order statistics over "time behind winner" samples.
 * Every method copies and sorts its input, so results never depend on the
 * order the samples were collected in.
 */
public final class LatencyStats {

  /** Worst-tail fraction for P90. */
  public static final double P90_TAIL = 0.10;
  /** Worst-tail fraction for P95. */
  public static final double P95_TAIL = 0.05;
  /** Worst-tail fraction for P99. */
  public static final double P99_TAIL = 0.01;

  private LatencyStats() {}

  /**
   * Standard median; the mean of the two middle values for an even count.
   *
   * @param values samples in nanoseconds
   * @return the median, or 0 for no samples
   */
  public static double median(List<Long> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    List<Long> sorted = new ArrayList<>(values);
    sorted.sort(Comparator.naturalOrder());
    int n = sorted.size();
    if (n % 2 == 1) {
      return sorted.get(n / 2);
    }
    return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
  }

  /**
   * Nearest-rank percentile on the worst-first ordering.
   *
   * <p>Samples are sorted descending and the value at index
   * {@code ceil(n * tailFraction) - 1} is returned, clamped to the list bounds.
   * With few samples the tail collapses onto the single worst value, e.g. five
   * samples give the maximum for P90, P95 and P99 alike.
   *
   * @param values samples in nanoseconds
   * @param tailFraction fraction of worst samples, e.g. 0.01 for P99
   * @return the percentile value, or 0 for no samples
   */
  public static long tailPercentile(List<Long> values, double tailFraction) {
    if (values == null || values.isEmpty()) {
      return 0L;
    }
    List<Long> worstFirst = new ArrayList<>(values);
    worstFirst.sort(Comparator.reverseOrder());
    int n = worstFirst.size();
    int index = (int) Math.ceil(n * tailFraction) - 1;
    index = Math.max(0, Math.min(n - 1, index));
    return worstFirst.get(index);
  }

  public static double mean(List<Long> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    double sum = 0.0;
    for (long value : values) {
      sum += value;
    }
    return sum / values.size();
  }

  /**
   * Formats nanoseconds as milliseconds with microsecond precision.
   */
  public static String formatMillis(double nanos) {
    return String.format(Locale.ROOT, "%.3f", nanos / 1_000_000.0);
  }
}
