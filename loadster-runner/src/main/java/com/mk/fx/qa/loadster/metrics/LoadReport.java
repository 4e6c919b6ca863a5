package com.mk.fx.qa.loadster.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics derived from the samples of one run. Latencies are fractional milliseconds.
 *
 * <p>{@code throughputRps} divides the completed count by the <em>sum</em> of the individual
 * latencies, not by the wall-clock span of the run. Status codes iterate in ascending order, but
 * callers should not depend on that.
 */
public record LoadReport(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double totalLatencyMs,
    double averageLatencyMs,
    double minLatencyMs,
    double medianLatencyMs,
    double p75LatencyMs,
    double p95LatencyMs,
    double p99LatencyMs,
    double maxLatencyMs,
    double throughputRps,
    Map<Integer, StatusCodeShare> statusCodes,
    SuccessLatency successLatency) {

  public LoadReport {
    successLatency = successLatency == null ? SuccessLatency.NONE : successLatency;
    statusCodes =
        Collections.unmodifiableSortedMap(statusCodes == null ? new TreeMap<>() : new TreeMap<>(statusCodes));
  }

  /** Report of a run that completed no call at all. */
  public static LoadReport empty() {
    return new LoadReport(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, new TreeMap<>(), SuccessLatency.NONE);
  }

  /** Sum of the sample latencies in seconds; the denominator of {@link #throughputRps()}. */
  public double totalLatencySeconds() {
    return totalLatencyMs / 1000.0;
  }

  /**
   * Occurrences of one status code.
   *
   * @param count number of samples with this code
   * @param percentage {@code 100 * count / total}
   */
  public record StatusCodeShare(long count, double percentage) {}

  /** Latency statistics over 2xx samples only; zero when there are none. */
  public record SuccessLatency(double minMs, double maxMs, double averageMs) {
    public static final SuccessLatency NONE = new SuccessLatency(0, 0, 0);
  }
}
