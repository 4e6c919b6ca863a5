package com.mk.fx.qa.loadster.metrics;

import com.mk.fx.qa.loadster.model.Sample;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the samples of a finished run into a {@link LoadReport}. Pure: the input is never modified
 * and an empty input yields {@link LoadReport#empty()}.
 */
public final class SampleAggregator {

  private static final double NANOS_PER_MILLI = 1_000_000.0;

  private SampleAggregator() {
    // Utility class, no instantiation
  }

  public static LoadReport aggregate(Collection<Sample> samples) {
    Objects.requireNonNull(samples, "samples");
    if (samples.isEmpty()) {
      return LoadReport.empty();
    }

    int total = samples.size();
    long[] latencies = new long[total];
    long totalNanos = 0;
    long successful = 0;
    long successNanos = 0;
    long successMin = Long.MAX_VALUE;
    long successMax = Long.MIN_VALUE;
    Map<Integer, Long> counts = new HashMap<>();

    int i = 0;
    for (Sample sample : samples) {
      long nanos = sample.latency().toNanos();
      latencies[i++] = nanos;
      totalNanos += nanos;
      counts.merge(sample.status(), 1L, Long::sum);
      if (sample.isSuccess()) {
        successful++;
        successNanos += nanos;
        successMin = Math.min(successMin, nanos);
        successMax = Math.max(successMax, nanos);
      }
    }
    Arrays.sort(latencies);

    Map<Integer, LoadReport.StatusCodeShare> statusCodes = new HashMap<>();
    counts.forEach(
        (code, count) ->
            statusCodes.put(code, new LoadReport.StatusCodeShare(count, count * 100.0 / total)));

    var successLatency =
        successful == 0
            ? LoadReport.SuccessLatency.NONE
            : new LoadReport.SuccessLatency(
                toMillis(successMin), toMillis(successMax), toMillis(successNanos) / successful);

    double totalMs = toMillis(totalNanos);
    double totalSeconds = totalMs / 1000.0;

    return new LoadReport(
        total,
        successful,
        total - successful,
        totalMs,
        totalMs / total,
        toMillis(latencies[0]),
        toMillis(percentile(latencies, 50)),
        toMillis(percentile(latencies, 75)),
        toMillis(percentile(latencies, 95)),
        toMillis(percentile(latencies, 99)),
        toMillis(latencies[total - 1]),
        totalSeconds > 0 ? total / totalSeconds : 0.0,
        statusCodes,
        successLatency);
  }

  /**
   * Value at index {@code floor(k / 100 * n)} of an ascending array, clamped to {@code [0, n - 1]}.
   * No interpolation.
   *
   * @param sorted ascending values, not empty
   * @param k percentile between 0 and 100
   */
  static long percentile(long[] sorted, int k) {
    if (k < 0 || k > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (sorted.length == 0) {
      throw new IllegalArgumentException("Percentile of an empty sample set is undefined");
    }
    int index = (int) Math.floor(sorted.length * (k / 100.0));
    index = Math.min(sorted.length - 1, Math.max(0, index));
    return sorted[index];
  }

  private static double toMillis(long nanos) {
    return nanos / NANOS_PER_MILLI;
  }
}
